package com.digitalgroup.zapdesk.integration.whatsapp.provider;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;

/**
 * What an adapter needs to deliver one message.
 *
 * @param chatId     channel chat id (phone@c.us or masked@lid)
 * @param fullPhone  digits with country code, null for masked contacts
 * @param content    rendered text or caption
 * @param mediaUrl   fetchable URL, already resolved from storage
 * @param replyToId  gateway id of the quoted message
 */
public record OutboundMessage(
        String chatId,
        String fullPhone,
        String content,
        MessageContentType type,
        String mediaUrl,
        String fileName,
        String replyToId
) {

    public static OutboundMessage text(String chatId, String fullPhone, String content) {
        return new OutboundMessage(chatId, fullPhone, content, MessageContentType.TEXT, null, null, null);
    }

    /**
     * Address for vendors that take bare numbers: the phone when known, else the chat id digits.
     */
    public String recipientNumber() {
        if (fullPhone != null && !fullPhone.isBlank()) {
            return fullPhone;
        }
        int at = chatId != null ? chatId.indexOf('@') : -1;
        return at > 0 ? chatId.substring(0, at) : chatId;
    }

    public boolean hasCaption() {
        return content != null && !content.isBlank();
    }
}
