package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;

/**
 * Send capability of one gateway vendor. Implementations throw
 * {@link com.digitalgroup.zapdesk.exception.ProviderException} on any non-success answer.
 */
public interface WhatsAppProviderClient {

    GatewayProvider provider();

    ProviderSendResult sendText(GatewayConfig config, OutboundMessage message);

    ProviderSendResult sendImage(GatewayConfig config, OutboundMessage message);

    ProviderSendResult sendAudio(GatewayConfig config, OutboundMessage message);

    ProviderSendResult sendVideo(GatewayConfig config, OutboundMessage message);

    ProviderSendResult sendDocument(GatewayConfig config, OutboundMessage message);

    default ProviderSendResult send(GatewayConfig config, OutboundMessage message) {
        return switch (message.type()) {
            case TEXT -> sendText(config, message);
            case IMAGE -> sendImage(config, message);
            case AUDIO -> sendAudio(config, message);
            case VIDEO -> sendVideo(config, message);
            case DOCUMENT -> sendDocument(config, message);
        };
    }
}
