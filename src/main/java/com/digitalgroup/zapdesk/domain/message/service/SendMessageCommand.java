package com.digitalgroup.zapdesk.domain.message.service;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;

/**
 * Agent request to send into a conversation.
 *
 * @param mediaRef  storage reference or URL of the attachment
 * @param agentId   sending agent, becomes the assignee of an unassigned conversation
 * @param agentName rendered into {{atendente}}
 */
public record SendMessageCommand(
        Long conversationId,
        String content,
        MessageContentType type,
        String mediaRef,
        String replyToExternalId,
        Long agentId,
        String agentName
) {
}
