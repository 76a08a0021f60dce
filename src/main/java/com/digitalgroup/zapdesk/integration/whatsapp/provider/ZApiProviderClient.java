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
 * Z-API adapter. The base URL already carries the instance and token path segments;
 * the account security token goes in {@code Client-Token}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ZApiProviderClient implements WhatsAppProviderClient {

    private static final String CLIENT_TOKEN_HEADER = "Client-Token";

    private final GatewayHttpClient httpClient;

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.ZAPI;
    }

    @Override
    public ProviderSendResult sendText(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("phone", message.recipientNumber());
        body.put("message", message.content());
        if (message.replyToId() != null) {
            body.put("messageId", message.replyToId());
        }
        return dispatch(config, "/send-text", body, message);
    }

    @Override
    public ProviderSendResult sendImage(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("phone", message.recipientNumber());
        body.put("image", message.mediaUrl());
        if (message.hasCaption()) {
            body.put("caption", message.content());
        }
        return dispatch(config, "/send-image", body, message);
    }

    @Override
    public ProviderSendResult sendAudio(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("phone", message.recipientNumber());
        body.put("audio", message.mediaUrl());
        return dispatch(config, "/send-audio", body, message);
    }

    @Override
    public ProviderSendResult sendVideo(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("phone", message.recipientNumber());
        body.put("video", message.mediaUrl());
        if (message.hasCaption()) {
            body.put("caption", message.content());
        }
        return dispatch(config, "/send-video", body, message);
    }

    @Override
    public ProviderSendResult sendDocument(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("phone", message.recipientNumber());
        body.put("document", message.mediaUrl());
        if (message.fileName() != null) {
            body.put("fileName", message.fileName());
        }
        String extension = extension(message);
        return dispatch(config, "/send-document/" + extension, body, message);
    }

    private String extension(OutboundMessage message) {
        String source = message.fileName() != null ? message.fileName() : message.mediaUrl();
        if (source != null) {
            String path = source.contains("?") ? source.substring(0, source.indexOf('?')) : source;
            int dot = path.lastIndexOf('.');
            if (dot >= 0 && dot > path.lastIndexOf('/') && dot < path.length() - 1) {
                return path.substring(dot + 1).toLowerCase();
            }
        }
        return "pdf";
    }

    private ProviderSendResult dispatch(GatewayConfig config, String path, Map<String, Object> body,
                                        OutboundMessage message) {
        String url = config.getNormalizedBaseUrl() + path;
        GatewayResponse response = httpClient.post(provider(), url,
                headers -> headers.set(CLIENT_TOKEN_HEADER, config.getApiKey()), body);
        if (!response.isSuccess()) {
            throw ProviderException.fromResponse(provider(), response.status(), response.body());
        }

        String messageId = PayloadUtils.firstString(response.json(), "messageId", "zaapId", "id");
        log.info("Z-API {} sent to {} (id={})", message.type(), message.recipientNumber(), messageId);
        return new ProviderSendResult(messageId, null);
    }
}
