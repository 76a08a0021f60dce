package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageDirection;
import com.digitalgroup.zapdesk.domain.common.enums.MessageOrigin;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;
import com.digitalgroup.zapdesk.domain.common.enums.SenderType;
import com.digitalgroup.zapdesk.domain.conversation.entity.Conversation;
import com.digitalgroup.zapdesk.domain.conversation.service.ConversationService;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.lead.entity.Lead;
import com.digitalgroup.zapdesk.domain.lead.service.LeadService;
import com.digitalgroup.zapdesk.domain.message.entity.Message;
import com.digitalgroup.zapdesk.integration.whatsapp.provider.ProviderSendResult;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Agent send path: render the template, dispatch, then record what was sent.
 *
 * Once the gateway accepted the message the send counts as done. A failure
 * while recording it is logged and the outcome comes back without a message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboundMessageService {

    private final ConversationService conversationService;
    private final GatewayConfigService gatewayConfigService;
    private final LeadService leadService;
    private final MessageLedgerService ledger;
    private final TemplateVariableService templateVariableService;
    private final OutboundDispatcher dispatcher;

    public SendOutcome send(SendMessageCommand command) {
        Conversation conversation = conversationService.findById(command.conversationId());
        TenantContext.setCurrentTenant(conversation.getTenantId());
        try {
            Lead lead = conversation.getLead();
            GatewayConfig config = gatewayConfigService.forConversation(conversation);
            MessageContentType type = command.type() != null ? command.type() : MessageContentType.TEXT;
            String content = templateVariableService.render(command.content(), lead, command.agentName());

            String cachedChatId = lead.isMasked() ? lead.getDeliveryChatId() : lead.getWhatsappChatId();
            ProviderSendResult result = dispatcher.send(config, lead.getFullPhone(), content, type,
                    command.mediaRef(), cachedChatId, command.replyToExternalId());

            Message message = null;
            try {
                message = recordSent(command, conversation, lead, content, type, result);
            } catch (RuntimeException e) {
                log.error("Message {} was sent via {} but could not be recorded for conversation {}",
                        result.providerMessageId(), config.getProvider(), conversation.getId(), e);
            }
            return new SendOutcome(result.providerMessageId(), result.resolvedChatId(), message, config.getProvider());
        } finally {
            TenantContext.clear();
        }
    }

    private Message recordSent(SendMessageCommand command, Conversation conversation, Lead lead, String content,
                               MessageContentType type, ProviderSendResult result) {
        LocalDateTime now = LocalDateTime.now();
        Message message = ledger.record(Message.builder()
                .tenantId(conversation.getTenantId())
                .conversation(conversation)
                .lead(lead)
                .senderType(SenderType.AGENT)
                .senderId(command.agentId())
                .direction(MessageDirection.OUTBOUND)
                .content(content != null ? content : "")
                .mediaUrl(command.mediaRef())
                .type(type)
                .status(MessageStatus.SENT)
                .externalId(result.providerMessageId())
                .origin(MessageOrigin.API)
                .quotedExternalId(command.replyToExternalId())
                .sentAt(now)
                .build());

        conversationService.registerOutbound(conversation, now);
        if (conversationService.assignIfUnassigned(conversation, command.agentId())) {
            leadService.assignIfUnassigned(lead, command.agentId());
        }
        if (!lead.isMasked()) {
            leadService.cacheDeliveryChatId(lead, result.resolvedChatId());
        }
        return message;
    }
}
