package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.exception.ProviderFailureCause;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayHttpClient;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayResponse;
import com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * WhatsApp Cloud API adapter.
 * The gateway config's instance name is the phone-number-id and its API key the access token.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetaCloudProviderClient implements WhatsAppProviderClient {

    // Graph error code for "recipient is not a WhatsApp user"
    private static final long RECIPIENT_NOT_ON_WHATSAPP = 131026L;

    private final GatewayHttpClient httpClient;

    @Value("${whatsapp.api-version:v19.0}")
    private String apiVersion;

    @Value("${whatsapp.base-url:https://graph.facebook.com}")
    private String defaultBaseUrl;

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.META_CLOUD;
    }

    @Override
    public ProviderSendResult sendText(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> payload = basePayload(message, "text");
        payload.put("text", Map.of("body", message.content()));
        return sendRequest(config, payload, message);
    }

    @Override
    public ProviderSendResult sendImage(GatewayConfig config, OutboundMessage message) {
        return sendMedia(config, message, "image");
    }

    @Override
    public ProviderSendResult sendAudio(GatewayConfig config, OutboundMessage message) {
        return sendMedia(config, message, "audio");
    }

    @Override
    public ProviderSendResult sendVideo(GatewayConfig config, OutboundMessage message) {
        return sendMedia(config, message, "video");
    }

    @Override
    public ProviderSendResult sendDocument(GatewayConfig config, OutboundMessage message) {
        return sendMedia(config, message, "document");
    }

    private ProviderSendResult sendMedia(GatewayConfig config, OutboundMessage message, String type) {
        Map<String, Object> mediaContent = new HashMap<>();
        mediaContent.put("link", message.mediaUrl());
        if (message.hasCaption() && !"audio".equals(type)) {
            mediaContent.put("caption", message.content());
        }
        if ("document".equals(type) && message.fileName() != null) {
            mediaContent.put("filename", message.fileName());
        }

        Map<String, Object> payload = basePayload(message, type);
        payload.put(type, mediaContent);
        return sendRequest(config, payload, message);
    }

    private Map<String, Object> basePayload(OutboundMessage message, String type) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("messaging_product", "whatsapp");
        payload.put("recipient_type", "individual");
        payload.put("to", message.recipientNumber());
        payload.put("type", type);
        if (message.replyToId() != null) {
            payload.put("context", Map.of("message_id", message.replyToId()));
        }
        return payload;
    }

    private ProviderSendResult sendRequest(GatewayConfig config, Map<String, Object> payload,
                                           OutboundMessage message) {
        String base = config.getBaseUrl() != null && !config.getBaseUrl().isBlank()
                ? config.getNormalizedBaseUrl() : defaultBaseUrl;
        String url = String.format("%s/%s/%s/messages", base, apiVersion, config.getInstanceName());

        GatewayResponse response = httpClient.post(provider(), url,
                headers -> headers.setBearerAuth(config.getApiKey() != null ? config.getApiKey() : ""), payload);
        if (!response.isSuccess()) {
            throw toProviderException(response);
        }

        List<Map<String, Object>> messages = PayloadUtils.getList(response.json(), "messages");
        String messageId = messages.isEmpty() ? null : PayloadUtils.getString(messages.get(0), "id");
        List<Map<String, Object>> contacts = PayloadUtils.getList(response.json(), "contacts");
        String waId = contacts.isEmpty() ? null : PayloadUtils.getString(contacts.get(0), "wa_id");

        log.info("WhatsApp Cloud {} sent to {} (id={})", message.type(), message.recipientNumber(), messageId);
        return new ProviderSendResult(messageId, waId);
    }

    private ProviderException toProviderException(GatewayResponse response) {
        Long code = PayloadUtils.getLong(response.json(), "error.code");
        if (code != null && code == RECIPIENT_NOT_ON_WHATSAPP) {
            return new ProviderException(provider(), ProviderFailureCause.IDENTITY_RESOLUTION_FAILURE,
                    "Recipient is not a WhatsApp user", response.status());
        }
        String message = PayloadUtils.getString(response.json(), "error.message");
        return ProviderException.fromResponse(provider(), response.status(),
                message != null ? message : response.body());
    }
}
