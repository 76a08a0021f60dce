package com.digitalgroup.zapdesk.domain.common.enums;

import lombok.Getter;

/**
 * Where a message was produced.
 * SYSTEM for inbound traffic, PAIRED_DEVICE for messages typed on the phone paired to the gateway,
 * API for messages sent through this service.
 */
@Getter
public enum MessageOrigin {
    SYSTEM(0),
    PAIRED_DEVICE(1),
    API(2);

    private final int value;

    MessageOrigin(int value) {
        this.value = value;
    }

    public static MessageOrigin fromValue(int value) {
        for (MessageOrigin origin : MessageOrigin.values()) {
            if (origin.value == value) {
                return origin;
            }
        }
        return SYSTEM;
    }
}
