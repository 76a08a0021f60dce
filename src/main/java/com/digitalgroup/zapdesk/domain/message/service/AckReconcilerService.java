package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.MessageDirection;
import com.digitalgroup.zapdesk.domain.common.enums.MessageOrigin;
import com.digitalgroup.zapdesk.domain.common.enums.SenderType;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.conversation.service.ConversationService;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.ContactIdentity;
import com.digitalgroup.zapdesk.domain.lead.service.IdentityResolverService;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.domain.lead.service.MaskedIdentityResolution;
import com.digitalgroup.zapdesk.domain.message.entity.Message;
import com.digitalgroup.zapdesk.exception.PhoneValidationException;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.AckEvent;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.IgnoreReason;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookResult;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * ACK reconciler.
 * Applies delivery and read receipts to stored messages. A receipt for a message
 * typed on the paired phone, which never went through us, creates that message
 * when its recipient is already a lead. Receipts never create leads. Receipts that
 * match nothing are answered as ignored and never retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AckReconcilerService {

    private final MessageLedgerService ledger;
    private final IdentityResolverService identityResolver;
    private final LeadService leadService;
    private final ConversationService conversationService;

    @Transactional
    public WebhookResult reconcile(GatewayConfig config, AckEvent ack) {
        String messageId = ack.messageId();
        if (messageId == null || messageId.isBlank()) {
            return WebhookResult.ignored(IgnoreReason.MESSAGE_NOT_FOUND);
        }
        if (ack.status() == null) {
            log.debug("Receipt {} for {} is not tracked", ack.receiptKind(), messageId);
            return WebhookResult.ignored(IgnoreReason.UNTRACKED_RECEIPT, messageId);
        }
        String status = ack.status().name().toLowerCase(Locale.ROOT);

        Optional<Message> existing = ledger.findByProviderId(config.getTenantId(), messageId);
        if (existing.isPresent()) {
            Message message = existing.get();
            if (message.advanceStatus(ack.status())) {
                ledger.save(message);
                log.info("Message {} marked {}", message.getId(), status);
            } else {
                log.debug("Message {} already {}, receipt {} ignored", message.getId(), message.getStatus(), status);
            }
            return WebhookResult.ack(status, messageId);
        }

        if (!ack.fromMe()) {
            log.debug("No message matches receipt {}", messageId);
            return WebhookResult.ignored(IgnoreReason.MESSAGE_NOT_FOUND, messageId);
        }
        return synthesize(config, ack, status);
    }

    /**
     * The receipt belongs to a message sent from the paired phone: record it as outbound.
     */
    private WebhookResult synthesize(GatewayConfig config, AckEvent ack, String status) {
        String recipient = ack.recipientId();
        if (recipient == null || ChatIdUtils.isGroupChat(recipient) || ChatIdUtils.isStatusBroadcast(recipient)) {
            return WebhookResult.ignored(IgnoreReason.MESSAGE_NOT_FOUND, ack.messageId());
        }
        if (config.isOwnNumber(recipient)) {
            return WebhookResult.ignored(IgnoreReason.SELF_MESSAGE_ACK, ack.messageId());
        }

        ContactIdentity identity;
        try {
            identity = recipientIdentity(config, recipient);
        } catch (PhoneValidationException e) {
            log.warn("Receipt {} has an unusable recipient {}: {}", ack.messageId(), recipient, e.getMessage());
            return WebhookResult.ignored(IgnoreReason.INVALID_PHONE, ack.messageId());
        }
        if (identity == null) {
            log.warn("Receipt {} is for masked id {} with no known lead", ack.messageId(), recipient);
            return WebhookResult.ignored(IgnoreReason.ACK_FOR_UNRESOLVED_LID_NO_LEAD, ack.messageId());
        }

        Optional<Lead> found = leadService.find(config.getTenantId(), identity);
        if (found.isEmpty()) {
            log.info("Receipt {} is for {} who is not a lead yet", ack.messageId(), recipient);
            return WebhookResult.ignored(IgnoreReason.ACK_FOR_UNKNOWN_LEAD, ack.messageId());
        }
        Lead lead = found.get();
        Conversation conversation = conversationService.resolveForLead(lead, config, false);

        Message message = ledger.record(Message.builder()
                .tenantId(config.getTenantId())
                .conversation(conversation)
                .lead(lead)
                .senderType(SenderType.AGENT)
                .direction(MessageDirection.OUTBOUND)
                .content(ack.body() != null && !ack.body().isBlank() ? ack.body() : "[" + ack.type().getCode() + "]")
                .type(ack.type())
                .status(ack.status())
                .externalId(ack.messageId())
                .origin(MessageOrigin.PAIRED_DEVICE)
                .sentAt(ack.timestamp())
                .build());
        conversationService.registerOutbound(conversation, message.getSentAt());

        log.info("Recorded paired-device message {} from receipt {} for lead {}",
                message.getId(), ack.messageId(), lead.getId());
        return WebhookResult.ack(status, ack.messageId());
    }

    private ContactIdentity recipientIdentity(GatewayConfig config, String recipient) {
        if (!ChatIdUtils.isMasked(recipient)) {
            return ContactIdentity.ofPhone(identityResolver.normalizeFullNumber(recipient));
        }
        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, recipient);
        if (!resolution.isResolved()) {
            return null;
        }
        return resolution.hasPhone()
                ? ContactIdentity.of(identityResolver.normalizeFullNumber(resolution.phoneDigits()), recipient)
                : ContactIdentity.of(null, recipient);
    }
}
