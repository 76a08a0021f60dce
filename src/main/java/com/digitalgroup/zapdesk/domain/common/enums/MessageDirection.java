package com.digitalgroup.zapdesk.domain.common.enums;

import lombok.Getter;

@Getter
public enum MessageDirection {
    INBOUND(0),
    OUTBOUND(1);

    private final int value;

    MessageDirection(int value) {
        this.value = value;
    }

    public static MessageDirection fromValue(int value) {
        for (MessageDirection direction : MessageDirection.values()) {
            if (direction.value == value) {
                return direction;
            }
        }
        return INBOUND;
    }

    public boolean isInbound() {
        return this == INBOUND;
    }

    public boolean isOutbound() {
        return this == OUTBOUND;
    }
}
