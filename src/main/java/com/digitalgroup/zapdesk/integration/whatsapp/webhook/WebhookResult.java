package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body returned to the gateway. Always sent with HTTP 200.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookResult(
        boolean success,
        Boolean ignored,
        String reason,
        String event,
        String status,
        String messageId,
        Long leadId,
        Long conversationId,
        String error,
        List<WebhookResult> results
) {

    public static WebhookResult ignored(String reason) {
        return new WebhookResult(true, true, reason, null, null, null, null, null, null, null);
    }

    public static WebhookResult ignored(String reason, String messageId) {
        return new WebhookResult(true, true, reason, null, null, messageId, null, null, null, null);
    }

    public static WebhookResult message(String messageId, Long leadId, Long conversationId) {
        return new WebhookResult(true, null, null, "message", null, messageId, leadId, conversationId, null, null);
    }

    public static WebhookResult ack(String status, String messageId) {
        return new WebhookResult(true, null, null, "ack", status, messageId, null, null, null, null);
    }

    public static WebhookResult failed(String error) {
        return new WebhookResult(false, null, null, null, null, null, null, null, error, null);
    }

    /**
     * Single results pass through; several are wrapped.
     */
    public static WebhookResult of(List<WebhookResult> results) {
        if (results.isEmpty()) {
            return ignored(IgnoreReason.UNSUPPORTED_EVENT);
        }
        if (results.size() == 1) {
            return results.get(0);
        }
        return new WebhookResult(true, null, null, "batch", null, null, null, null, null, List.copyOf(results));
    }

    public boolean isIgnored() {
        return Boolean.TRUE.equals(ignored);
    }
}
