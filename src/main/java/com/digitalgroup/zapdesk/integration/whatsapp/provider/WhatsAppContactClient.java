package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;

import java.util.Optional;

/**
 * Contact lookups some gateways offer on top of sending.
 */
public interface WhatsAppContactClient {

    GatewayProvider provider();

    /**
     * Maps a masked identifier to the real phone digits, when the gateway knows it.
     */
    Optional<String> resolveMaskedIdentity(GatewayConfig config, String maskedId);

    /**
     * Chat id under which the number is registered, trying regional variants.
     */
    Optional<String> findChatId(GatewayConfig config, String fullPhone);

    ProfilePictureResult fetchProfilePicture(GatewayConfig config, String contactId, boolean masked);
}
