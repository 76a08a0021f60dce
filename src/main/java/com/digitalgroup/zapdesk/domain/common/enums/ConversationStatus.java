package com.digitalgroup.zapdesk.domain.common.enums;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

@Getter
public enum ConversationStatus {
    OPEN(0),
    PENDING(1),
    RESOLVED(2);

    public static final Set<ConversationStatus> ACTIVE = EnumSet.of(OPEN, PENDING);

    private final int value;

    ConversationStatus(int value) {
        this.value = value;
    }

    public static ConversationStatus fromValue(int value) {
        for (ConversationStatus status : ConversationStatus.values()) {
            if (status.value == value) {
                return status;
            }
        }
        return OPEN;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isPending() {
        return this == PENDING;
    }
}
