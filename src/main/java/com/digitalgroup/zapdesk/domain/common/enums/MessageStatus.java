package com.digitalgroup.zapdesk.domain.common.enums;

import lombok.Getter;

/**
 * Delivery state of a message. Only moves forward: sent, delivered, read.
 */
@Getter
public enum MessageStatus {
    SENT(0),
    DELIVERED(1),
    READ(2);

    private final int value;

    MessageStatus(int value) {
        this.value = value;
    }

    public static MessageStatus fromValue(int value) {
        for (MessageStatus status : MessageStatus.values()) {
            if (status.value == value) {
                return status;
            }
        }
        return SENT;
    }

    public boolean isAfter(MessageStatus other) {
        return other == null || this.value > other.value;
    }
}
