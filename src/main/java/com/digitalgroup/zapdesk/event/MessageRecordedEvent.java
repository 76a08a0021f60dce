package com.digitalgroup.zapdesk.event;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageDirection;
import com.digitalgroup.zapdesk.domain.common.enums.MessageOrigin;

public record MessageRecordedEvent(
        Long messageId,
        Long conversationId,
        Long leadId,
        Long tenantId,
        MessageDirection direction,
        MessageContentType type,
        MessageOrigin origin
) {
}
