package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Set;

/**
 * A message as reported by any gateway, reduced to the fields the pipeline reads.
 *
 * @param chatId         the contact side of the chat: sender for inbound, recipient for fromMe
 * @param alternatePhone real phone found elsewhere in the payload when chatId is masked
 * @param mediaData      base64 file content, for gateways that inline media in the webhook
 */
public record InboundMessageEvent(
        String messageId,
        boolean fromMe,
        String chatId,
        String alternatePhone,
        String senderName,
        String body,
        String rawType,
        String mimeType,
        String mediaUrl,
        String mediaData,
        boolean hasMedia,
        String quotedMessageId,
        LocalDateTime timestamp
) {

    private static final Set<String> SYSTEM_TYPES = Set.of(
            "notification_template", "e2e_notification", "gp2", "ciphertext",
            "protocol", "call_log", "revoked", "protocolmessage", "reactionmessage");

    public boolean isSystem() {
        return rawType != null && SYSTEM_TYPES.contains(rawType.toLowerCase(Locale.ROOT));
    }

    /**
     * Content type from the gateway type, falling back to the mimetype when the
     * gateway reports a media message as plain chat.
     */
    public MessageContentType contentType() {
        MessageContentType type = MessageContentType.fromGatewayType(rawType);
        if (type != MessageContentType.TEXT || !carriesMedia()) {
            return type;
        }
        if (mimeType != null) {
            String mime = mimeType.toLowerCase(Locale.ROOT);
            if (mime.startsWith("audio/") || mime.contains("ogg")) {
                return MessageContentType.AUDIO;
            }
            if (mime.startsWith("image/")) {
                return MessageContentType.IMAGE;
            }
            if (mime.startsWith("video/")) {
                return MessageContentType.VIDEO;
            }
        }
        return MessageContentType.DOCUMENT;
    }

    public boolean carriesMedia() {
        return hasMedia || (mediaUrl != null && !mediaUrl.isBlank())
                || (mediaData != null && !mediaData.isBlank());
    }

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
