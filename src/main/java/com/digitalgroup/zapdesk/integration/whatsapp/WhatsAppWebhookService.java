package com.digitalgroup.zapdesk.integration.whatsapp;

import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.message.service.AckReconcilerService;
import com.digitalgroup.zapdesk.domain.message.service.InboundMessageService;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.AckEvent;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.IgnoreReason;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.InboundMessageEvent;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookEnvelope;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookPayloadParser;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookResult;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookSignatureVerifier;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * WhatsApp Webhook Service
 * Classifies every gateway delivery: finds the gateway, checks the signature,
 * filters chats we never track, then routes messages to the message path and
 * receipts to the ACK reconciler. Every outcome becomes a {@link WebhookResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WhatsAppWebhookService {

    private static final Pattern PLACEHOLDER = Pattern.compile(
            "^\\[(text|texto|media|mídia|midia|image|imagem|audio|áudio|video|vídeo|document|documento|sticker|"
                    + "mensagem vazia|mensagem não suportada)]$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private final WebhookPayloadParser parser;
    private final WebhookSignatureVerifier signatureVerifier;
    private final GatewayConfigService gatewayConfigService;
    private final InboundMessageService inboundMessageService;
    private final AckReconcilerService ackReconcilerService;

    public WebhookResult handle(Map<String, Object> payload, String rawBody, HttpHeaders headers) {
        List<WebhookEnvelope> envelopes = parser.parse(payload);
        if (envelopes.isEmpty()) {
            log.warn("Ignoring webhook in an unknown format");
            return WebhookResult.ignored(IgnoreReason.UNSUPPORTED_EVENT);
        }

        List<WebhookResult> results = new ArrayList<>();
        for (WebhookEnvelope envelope : envelopes) {
            results.addAll(handleEnvelope(envelope, rawBody, headers));
        }
        return WebhookResult.of(results);
    }

    private List<WebhookResult> handleEnvelope(WebhookEnvelope envelope, String rawBody, HttpHeaders headers) {
        if (envelope.isEmpty()) {
            log.debug("{} event {} carries nothing we track", envelope.provider(), envelope.eventName());
            return List.of(WebhookResult.ignored(IgnoreReason.UNSUPPORTED_EVENT));
        }

        Optional<GatewayConfig> gateway = gatewayConfigService.findForWebhook(envelope.provider(), envelope.instanceKey());
        if (gateway.isEmpty()) {
            log.warn("No active gateway for {} instance '{}'", envelope.provider(), envelope.instanceKey());
            return List.of(WebhookResult.ignored(IgnoreReason.GATEWAY_NOT_FOUND));
        }
        GatewayConfig config = gateway.get();
        signatureVerifier.verify(config, rawBody, headers);

        TenantContext.setCurrentTenant(config.getTenantId());
        try {
            List<WebhookResult> results = new ArrayList<>();
            for (InboundMessageEvent message : envelope.messages()) {
                results.add(handleMessage(config, message));
            }
            for (AckEvent ack : envelope.acks()) {
                results.add(handleAck(config, ack));
            }
            return results;
        } finally {
            TenantContext.clear();
        }
    }

    private WebhookResult handleMessage(GatewayConfig config, InboundMessageEvent message) {
        String reason = filter(config, message);
        if (reason != null) {
            log.warn("Ignoring message {} from {}: {}", message.messageId(), message.chatId(), reason);
            return WebhookResult.ignored(reason, message.messageId());
        }
        try {
            return inboundMessageService.process(config, message);
        } catch (RuntimeException e) {
            log.error("Failed to process message {} on gateway {}", message.messageId(), config.getName(), e);
            return WebhookResult.failed(e.getMessage());
        }
    }

    private WebhookResult handleAck(GatewayConfig config, AckEvent ack) {
        try {
            WebhookResult result = ackReconcilerService.reconcile(config, ack);
            if (result.isIgnored()) {
                log.warn("Ignoring receipt {}: {}", ack.messageId(), result.reason());
            }
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to reconcile receipt {} on gateway {}", ack.messageId(), config.getName(), e);
            return WebhookResult.failed(e.getMessage());
        }
    }

    /**
     * Returns the ignore reason, or null when the message should be recorded.
     */
    String filter(GatewayConfig config, InboundMessageEvent message) {
        String chatId = message.chatId();
        if (chatId == null || message.messageId() == null) {
            return IgnoreReason.INVALID_PAYLOAD;
        }
        if (ChatIdUtils.isGroupChat(chatId)) {
            return IgnoreReason.GROUP_MESSAGE;
        }
        if (ChatIdUtils.isStatusBroadcast(chatId)) {
            return IgnoreReason.STATUS_BROADCAST;
        }
        if (config.isOwnNumber(chatId)) {
            return IgnoreReason.SELF_MESSAGE;
        }
        if (message.isSystem()) {
            return IgnoreReason.SYSTEM_MESSAGE;
        }
        if (!message.hasBody() && !message.carriesMedia()) {
            return IgnoreReason.EMPTY_MESSAGE;
        }
        if (!message.carriesMedia() && PLACEHOLDER.matcher(message.body().trim()).matches()) {
            return IgnoreReason.PLACEHOLDER_CONTENT;
        }
        return null;
    }
}
