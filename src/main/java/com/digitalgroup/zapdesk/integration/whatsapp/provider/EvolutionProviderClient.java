package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.exception.ProviderException;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayHttpClient;
import com.digitalgroup.zapdesk.integration.whatsapp.GatewayResponse;
import com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * Evolution API adapter. Authenticates with the {@code apikey} header.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvolutionProviderClient implements WhatsAppProviderClient {

    private static final String API_KEY_HEADER = "apikey";
    private static final String DEFAULT_INSTANCE = "default";

    private final GatewayHttpClient httpClient;

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.EVOLUTION;
    }

    @Override
    public ProviderSendResult sendText(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("number", message.recipientNumber());
        body.put("text", message.content());
        if (message.replyToId() != null) {
            body.put("quoted", Map.of("key", Map.of("id", message.replyToId())));
        }
        return dispatch(config, "/message/sendText/", body, message);
    }

    @Override
    public ProviderSendResult sendImage(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, "/message/sendMedia/", mediaBody(message, "image"), message);
    }

    @Override
    public ProviderSendResult sendAudio(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("number", message.recipientNumber());
        body.put("audio", message.mediaUrl());
        return dispatch(config, "/message/sendWhatsAppAudio/", body, message);
    }

    @Override
    public ProviderSendResult sendVideo(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, "/message/sendMedia/", mediaBody(message, "video"), message);
    }

    @Override
    public ProviderSendResult sendDocument(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = mediaBody(message, "document");
        if (message.fileName() != null) {
            body.put("fileName", message.fileName());
        }
        return dispatch(config, "/message/sendMedia/", body, message);
    }

    private Map<String, Object> mediaBody(OutboundMessage message, String mediaType) {
        Map<String, Object> body = new HashMap<>();
        body.put("number", message.recipientNumber());
        body.put("mediatype", mediaType);
        body.put("media", message.mediaUrl());
        if (message.hasCaption()) {
            body.put("caption", message.content());
        }
        return body;
    }

    private ProviderSendResult dispatch(GatewayConfig config, String path, Map<String, Object> body,
                                        OutboundMessage message) {
        String instance = config.getInstanceName() != null ? config.getInstanceName() : DEFAULT_INSTANCE;
        String url = config.getNormalizedBaseUrl() + path + instance;

        GatewayResponse response = httpClient.post(provider(), url,
                headers -> headers.set(API_KEY_HEADER, config.getApiKey()), body);
        if (!response.isSuccess()) {
            throw ProviderException.fromResponse(provider(), response.status(), response.body());
        }

        String messageId = PayloadUtils.getString(response.json(), "key.id");
        log.info("Evolution {} sent to {} (id={})", message.type(), message.recipientNumber(), messageId);
        return new ProviderSendResult(messageId, PayloadUtils.getString(response.json(), "key.remoteJid"));
    }
}
