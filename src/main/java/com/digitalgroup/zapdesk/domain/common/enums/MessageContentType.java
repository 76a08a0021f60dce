package com.digitalgroup.zapdesk.domain.common.enums;

import lombok.Getter;

import java.util.Locale;

@Getter
public enum MessageContentType {
    TEXT(0, "text"),
    IMAGE(1, "image"),
    AUDIO(2, "audio"),
    VIDEO(3, "video"),
    DOCUMENT(4, "document");

    private final int value;
    private final String code;

    MessageContentType(int value, String code) {
        this.value = value;
        this.code = code;
    }

    /**
     * Maps a gateway message type to ours.
     * ptt and voice notes are audio, chat is text, stickers are images.
     */
    public static MessageContentType fromGatewayType(String type) {
        if (type == null || type.isBlank()) {
            return TEXT;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "image", "sticker", "imagemessage", "stickermessage" -> IMAGE;
            case "audio", "ptt", "voice", "audiomessage" -> AUDIO;
            case "video", "videomessage" -> VIDEO;
            case "document", "file", "documentmessage" -> DOCUMENT;
            default -> TEXT;
        };
    }

    public static MessageContentType fromCode(String code) {
        if (code == null) {
            return TEXT;
        }
        for (MessageContentType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + code);
    }

    public boolean isMedia() {
        return this != TEXT;
    }
}
