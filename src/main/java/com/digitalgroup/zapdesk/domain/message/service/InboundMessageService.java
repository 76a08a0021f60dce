package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageDirection;
import com.digitalgroup.zapdesk.domain.common.enums.MessageOrigin;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;
import com.digitalgroup.zapdesk.domain.common.enums.SenderType;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.conversation.service.ConversationService;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.ContactIdentity;
import com.digitalgroup.zapdesk.domain.lead.service.IdentityResolverService;
import com.digitalgroup.zapdesk.domain.lead.service.LeadResolution;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.domain.lead.service.MaskedIdentityResolution;
import com.digitalgroup.zapdesk.domain.message.entity.Message;
import com.digitalgroup.zapdesk.exception.PhoneValidationException;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.IgnoreReason;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.InboundMessageEvent;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookResult;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Message path of the webhook pipeline: identity, lead, conversation, media, ledger.
 * Handles both contact messages and messages typed on the paired phone (fromMe).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InboundMessageService {

    private final IdentityResolverService identityResolver;
    private final LeadService leadService;
    private final ConversationService conversationService;
    private final MessageLedgerService ledger;
    private final InboundMediaService mediaService;

    @Transactional
    public WebhookResult process(GatewayConfig config, InboundMessageEvent event) {
        if (ledger.isKnown(config.getTenantId(), event.messageId())) {
            log.debug("Message {} already recorded, skipping", event.messageId());
            return WebhookResult.ignored(IgnoreReason.DUPLICATE_MESSAGE, event.messageId());
        }

        ContactIdentity identity;
        try {
            identity = resolveIdentity(config, event);
        } catch (PhoneValidationException e) {
            log.warn("Rejected message {} from {}: {}", event.messageId(), event.chatId(), e.getMessage());
            return WebhookResult.ignored(IgnoreReason.INVALID_PHONE, event.messageId());
        }
        if (identity == null) {
            log.warn("Dropping message {}: masked id {} could not be resolved", event.messageId(), event.chatId());
            return WebhookResult.ignored(IgnoreReason.UNRESOLVED_MASKED_IDENTITY, event.messageId());
        }

        boolean inbound = !event.fromMe();
        LeadResolution resolution = leadService.findOrCreate(config, identity, inbound ? event.senderName() : null);
        Lead lead = resolution.lead();
        if (resolution.created() && lead.isMasked()) {
            identityResolver.scheduleMaskedIdentityResolution(lead, config, 1);
        }
        if (resolution.created() || resolution.unmasked()) {
            identityResolver.scheduleAvatarFetch(lead, config);
        }

        Conversation conversation = conversationService.resolveForLead(lead, config, inbound);
        Message message = ledger.record(buildMessage(config, event, lead, conversation));

        if (inbound) {
            conversationService.registerInbound(conversation, message.getSentAt());
        } else {
            conversationService.registerOutbound(conversation, message.getSentAt());
        }

        log.info("Recorded {} message {} for lead {} in conversation {}",
                inbound ? "inbound" : "paired-device", message.getId(), lead.getId(), conversation.getId());
        return WebhookResult.message(event.messageId(), lead.getId(), conversation.getId());
    }

    /**
     * Returns null when the contact is a masked id nobody can map and no lead holds it.
     */
    private ContactIdentity resolveIdentity(GatewayConfig config, InboundMessageEvent event) {
        String chatId = event.chatId();
        if (!ChatIdUtils.isMasked(chatId)) {
            return ContactIdentity.ofPhone(identityResolver.normalizeFullNumber(chatId));
        }

        if (event.alternatePhone() != null) {
            try {
                return ContactIdentity.of(identityResolver.normalizeFullNumber(event.alternatePhone()), chatId);
            } catch (PhoneValidationException e) {
                log.debug("Alternate phone {} in payload is not usable: {}", event.alternatePhone(), e.getMessage());
            }
        }

        MaskedIdentityResolution resolution = identityResolver.resolveMaskedIdentity(config, chatId);
        return switch (resolution.outcome()) {
            case RESOLVED -> resolution.hasPhone()
                    ? ContactIdentity.of(identityResolver.normalizeFullNumber(resolution.phoneDigits()), chatId)
                    : ContactIdentity.of(null, chatId);
            // gateway unreachable: keep the contact as a masked lead and resolve it in the background
            case PENDING -> event.fromMe() ? null : ContactIdentity.of(null, chatId);
            case UNRESOLVED -> null;
        };
    }

    private Message buildMessage(GatewayConfig config, InboundMessageEvent event, Lead lead,
                                 Conversation conversation) {
        MessageContentType type = event.contentType();
        boolean inbound = !event.fromMe();
        String content = event.hasBody() ? event.body() : "[" + type.getCode() + "]";

        return Message.builder()
                .tenantId(config.getTenantId())
                .conversation(conversation)
                .lead(lead)
                .senderType(inbound ? SenderType.LEAD : SenderType.AGENT)
                .senderId(inbound ? lead.getId() : null)
                .direction(inbound ? MessageDirection.INBOUND : MessageDirection.OUTBOUND)
                .content(content)
                .mediaUrl(mediaService.store(config, lead, event))
                .type(type)
                .status(inbound ? MessageStatus.DELIVERED : MessageStatus.SENT)
                .externalId(event.messageId())
                .origin(inbound ? MessageOrigin.SYSTEM : MessageOrigin.PAIRED_DEVICE)
                .quotedExternalId(event.quotedMessageId())
                .sentAt(event.timestamp())
                .build();
    }
}
