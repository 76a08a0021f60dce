package com.digitalgroup.zapdesk.util;

/**
 * Helpers for WhatsApp chat identifiers (jid-like strings).
 */
public final class ChatIdUtils {

    public static final String USER_SUFFIX = "@c.us";
    public static final String MASKED_SUFFIX = "@lid";
    public static final String MASKED_PHONE_PREFIX = "LID_";

    private ChatIdUtils() {}

    public static boolean isGroupChat(String chatId) {
        if (chatId == null) {
            return false;
        }
        return chatId.contains("@g.us") || chatId.contains("g.us") || chatId.startsWith("120363");
    }

    public static boolean isStatusBroadcast(String chatId) {
        return chatId != null && (chatId.contains("@broadcast") || chatId.startsWith("status@"));
    }

    /**
     * A masked identifier carries @lid, or is a 15+ digit handle without a phone suffix.
     */
    public static boolean isMasked(String chatId) {
        if (chatId == null || chatId.isEmpty()) {
            return false;
        }
        if (chatId.contains(MASKED_SUFFIX)) {
            return true;
        }
        if (chatId.contains(USER_SUFFIX) || chatId.contains("@s.whatsapp.net")) {
            return false;
        }
        return PhoneUtils.digitsOnly(chatId).length() >= 15;
    }

    public static String buildChatId(String fullNumber) {
        return PhoneUtils.digitsOnly(fullNumber) + USER_SUFFIX;
    }

    public static String maskedDigits(String maskedId) {
        return PhoneUtils.digitsOnly(maskedId);
    }

    /**
     * Phone column value for a lead known only by its masked identifier.
     */
    public static String maskedPhoneKey(String maskedId) {
        return MASKED_PHONE_PREFIX + maskedDigits(maskedId);
    }

    /**
     * Trailing segment of a composite message id such as {@code true_5511999@c.us_3EB0ABC}.
     * Returns the id itself when it has no separator.
     */
    public static String shortMessageId(String messageId) {
        if (messageId == null) {
            return null;
        }
        int idx = messageId.lastIndexOf('_');
        return idx >= 0 && idx < messageId.length() - 1 ? messageId.substring(idx + 1) : messageId;
    }
}
