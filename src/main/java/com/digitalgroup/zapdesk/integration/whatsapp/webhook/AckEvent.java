package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;

import java.time.LocalDateTime;

/**
 * Delivery or read receipt. {@code status} is null for receipt kinds we do not track
 * (server ack, failures).
 *
 * @param fromMe      the receipt is for a message sent from this number
 * @param recipientId contact the acknowledged message went to
 */
public record AckEvent(
        String messageId,
        MessageStatus status,
        String receiptKind,
        boolean fromMe,
        String recipientId,
        String body,
        MessageContentType type,
        LocalDateTime timestamp
) {

    public AckEvent {
        if (type == null) {
            type = MessageContentType.TEXT;
        }
    }
}
