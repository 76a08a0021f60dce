package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;

import java.util.List;

/**
 * One gateway's share of a webhook delivery.
 *
 * @param instanceKey session, instance name or phone-number-id identifying the gateway
 */
public record WebhookEnvelope(
        GatewayProvider provider,
        String eventName,
        String instanceKey,
        List<InboundMessageEvent> messages,
        List<AckEvent> acks
) {

    public boolean isEmpty() {
        return messages.isEmpty() && acks.isEmpty();
    }
}
