package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.message.entity.Message;

/**
 * @param message null when the send went out but could not be recorded
 */
public record SendOutcome(String providerMessageId, String resolvedChatId, Message message, GatewayProvider provider) {

    public boolean isRecorded() {
        return message != null;
    }
}
