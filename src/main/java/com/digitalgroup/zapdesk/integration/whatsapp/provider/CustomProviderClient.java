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
 * Generic adapter for in-house gateways: one endpoint, bearer token, flat JSON body.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomProviderClient implements WhatsAppProviderClient {

    private final GatewayHttpClient httpClient;

    @Override
    public GatewayProvider provider() {
        return GatewayProvider.CUSTOM;
    }

    @Override
    public ProviderSendResult sendText(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, message);
    }

    @Override
    public ProviderSendResult sendImage(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, message);
    }

    @Override
    public ProviderSendResult sendAudio(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, message);
    }

    @Override
    public ProviderSendResult sendVideo(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, message);
    }

    @Override
    public ProviderSendResult sendDocument(GatewayConfig config, OutboundMessage message) {
        return dispatch(config, message);
    }

    private ProviderSendResult dispatch(GatewayConfig config, OutboundMessage message) {
        Map<String, Object> body = new HashMap<>();
        body.put("phone", message.recipientNumber());
        body.put("message", message.content());
        body.put("type", message.type().getCode());
        if (message.mediaUrl() != null) {
            body.put("media_url", message.mediaUrl());
        }
        if (message.replyToId() != null) {
            body.put("reply_to", message.replyToId());
        }

        GatewayResponse response = httpClient.post(provider(), config.getNormalizedBaseUrl(),
                headers -> headers.setBearerAuth(config.getApiKey() != null ? config.getApiKey() : ""), body);
        if (!response.isSuccess()) {
            throw ProviderException.fromResponse(provider(), response.status(), response.body());
        }

        String messageId = PayloadUtils.firstString(response.json(), "messageId", "id");
        log.info("Custom gateway {} sent to {} (id={})", message.type(), message.recipientNumber(), messageId);
        return new ProviderSendResult(messageId, null);
    }
}
