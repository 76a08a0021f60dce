package com.digitalgroup.zapdesk.domain.common.enums;

import lombok.Getter;

@Getter
public enum SenderType {
    LEAD(0),
    AGENT(1);

    private final int value;

    SenderType(int value) {
        this.value = value;
    }

    public static SenderType fromValue(int value) {
        for (SenderType type : SenderType.values()) {
            if (type.value == value) {
                return type;
            }
        }
        return LEAD;
    }
}
