package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;
import com.digitalgroup.zapdesk.util.ChatIdUtils;
import com.digitalgroup.zapdesk.util.PhoneUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.firstString;
import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.get;
import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.getBoolean;
import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.getList;
import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.getLong;
import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.getMap;
import static com.digitalgroup.zapdesk.integration.whatsapp.PayloadUtils.getString;

/**
 * Reads the three webhook dialects we receive into {@link WebhookEnvelope}s:
 * WAHA ({@code event} + {@code session}), Evolution ({@code event} + {@code instance})
 * and Meta Cloud ({@code object} + {@code entry}).
 */
@Slf4j
@Component
public class WebhookPayloadParser {

    private static final String META_OBJECT = "whatsapp_business_account";
    private static final Set<String> DELIVERED_RECEIPTS = Set.of("DEVICE", "DELIVERY_ACK", "DELIVERED");
    private static final Set<String> READ_RECEIPTS = Set.of("READ", "PLAYED", "READ_ACK");

    /**
     * Returns no envelopes for payloads in none of the known dialects.
     */
    public List<WebhookEnvelope> parse(Map<String, Object> body) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }
        if (META_OBJECT.equals(body.get("object")) && body.get("entry") != null) {
            return parseMeta(body);
        }
        if (body.get("event") != null && body.containsKey("session")) {
            return List.of(parseWaha(body));
        }
        if (body.get("event") != null && body.containsKey("instance")) {
            return List.of(parseEvolution(body));
        }
        log.debug("Unrecognized webhook payload with keys {}", body.keySet());
        return List.of();
    }

    // ---- WAHA ----

    private WebhookEnvelope parseWaha(Map<String, Object> body) {
        String event = getString(body, "event");
        String session = getString(body, "session");
        Map<String, Object> payload = getMap(body, "payload");
        List<InboundMessageEvent> messages = new ArrayList<>();
        List<AckEvent> acks = new ArrayList<>();

        if (payload != null) {
            switch (event) {
                case "message", "message.any" -> messages.add(wahaMessage(payload));
                case "message.ack" -> acks.add(wahaAck(payload));
                default -> log.debug("WAHA event {} not handled", event);
            }
        }
        return new WebhookEnvelope(GatewayProvider.WAHA, event, session, messages, acks);
    }

    private InboundMessageEvent wahaMessage(Map<String, Object> payload) {
        boolean fromMe = getBoolean(payload, "fromMe");
        String chatId = fromMe
                ? firstString(payload, "to", "chatId", "_data.to")
                : firstString(payload, "from", "chatId", "_data.from");
        String rawType = firstString(payload, "_data.type", "type");
        String mediaUrl = firstString(payload, "media.url", "mediaUrl", "_data.media.url", "_data.deprecatedMms3Url");
        String mimeType = firstString(payload, "media.mimetype", "_data.mimetype", "_data.media.mimetype");
        String mediaData = firstString(payload, "media.data", "_data.media.data", "mediaData");
        boolean hasMedia = getBoolean(payload, "hasMedia");

        String body;
        if (hasMedia || mediaUrl != null) {
            String caption = firstString(payload, "caption", "_data.caption");
            String text = firstString(payload, "body", "_data.body");
            body = !isBlankOrBinary(caption) ? caption : (!isBlankOrBinary(text) ? text : null);
        } else {
            body = firstString(payload, "body", "_data.body", "text");
        }

        return new InboundMessageEvent(
                firstString(payload, "id", "_data.id"),
                fromMe,
                chatId,
                ChatIdUtils.isMasked(chatId) ? wahaAlternatePhone(payload) : null,
                firstString(payload, "pushName", "_data.pushName", "_data.notifyName", "sender.pushName"),
                body,
                rawType,
                mimeType,
                mediaUrl,
                mediaData,
                hasMedia,
                firstString(payload, "replyTo.id", "replyTo", "_data.quotedMsg.id", "_data.quotedStanzaID"),
                epoch(getLong(payload, "timestamp")));
    }

    /**
     * Masked senders sometimes carry the real number in another field of the same payload.
     */
    private String wahaAlternatePhone(Map<String, Object> payload) {
        for (String path : List.of("_data.from", "_data.chat.id", "chat.id", "_data.chatId",
                "_data.key.remoteJidAlt", "_data.key.senderPn")) {
            String candidate = getString(payload, path);
            if (candidate == null || candidate.contains(ChatIdUtils.MASKED_SUFFIX)) {
                continue;
            }
            if (candidate.contains(ChatIdUtils.USER_SUFFIX) || candidate.contains("@s.whatsapp.net")) {
                return PhoneUtils.digitsOnly(candidate);
            }
            String digits = PhoneUtils.digitsOnly(candidate);
            if (digits.length() >= 10 && digits.length() <= 13) {
                return digits;
            }
        }
        return null;
    }

    private AckEvent wahaAck(Map<String, Object> payload) {
        String ackName = firstString(payload, "ackName", "receipt_type");
        Long ackNumber = getLong(payload, "ack");
        boolean fromMe = getBoolean(payload, "fromMe");
        String recipient = fromMe ? firstString(payload, "to", "_data.to") : firstString(payload, "from", "_data.from");
        return new AckEvent(
                firstString(payload, "id", "key.id"),
                receiptStatus(ackName, ackNumber),
                ackName != null ? ackName : String.valueOf(ackNumber),
                fromMe,
                recipient,
                firstString(payload, "body", "_data.body"),
                MessageContentType.fromGatewayType(firstString(payload, "_data.type", "type")),
                epoch(getLong(payload, "timestamp")));
    }

    // ---- Evolution ----

    private WebhookEnvelope parseEvolution(Map<String, Object> body) {
        String event = getString(body, "event").toLowerCase(Locale.ROOT).replace('_', '.');
        String instance = getString(body, "instance");
        Map<String, Object> data = getMap(body, "data");
        List<InboundMessageEvent> messages = new ArrayList<>();
        List<AckEvent> acks = new ArrayList<>();

        if (data != null) {
            switch (event) {
                case "messages.upsert" -> messages.add(evolutionMessage(data));
                case "messages.update" -> acks.add(evolutionAck(data));
                default -> log.debug("Evolution event {} not handled", event);
            }
        }
        return new WebhookEnvelope(GatewayProvider.EVOLUTION, event, instance, messages, acks);
    }

    private InboundMessageEvent evolutionMessage(Map<String, Object> data) {
        String remoteJid = getString(data, "key.remoteJid");
        String messageType = getString(data, "messageType");

        String body = firstString(data, "message.conversation", "message.extendedTextMessage.text");
        String rawType = "text";
        String mediaUrl = null;
        String mimeType = null;
        for (String kind : List.of("imageMessage", "audioMessage", "videoMessage", "documentMessage", "stickerMessage")) {
            Map<String, Object> media = getMap(data, "message." + kind);
            if (media != null) {
                rawType = kind;
                mediaUrl = getString(media, "url");
                mimeType = getString(media, "mimetype");
                body = firstString(media, "caption", "fileName");
                break;
            }
        }
        if ("protocolMessage".equalsIgnoreCase(messageType) || "reactionMessage".equalsIgnoreCase(messageType)) {
            rawType = messageType;
        }

        String alternate = null;
        if (ChatIdUtils.isMasked(remoteJid)) {
            String candidate = firstString(data, "key.remoteJidAlt", "key.senderPn");
            alternate = candidate != null ? PhoneUtils.digitsOnly(candidate) : null;
        }

        return new InboundMessageEvent(
                getString(data, "key.id"),
                getBoolean(data, "key.fromMe"),
                remoteJid,
                alternate,
                getString(data, "pushName"),
                body,
                rawType,
                mimeType,
                mediaUrl,
                getString(data, "message.base64"),
                mediaUrl != null,
                firstString(data, "message.extendedTextMessage.contextInfo.stanzaId", "contextInfo.stanzaId"),
                epoch(getLong(data, "messageTimestamp")));
    }

    private AckEvent evolutionAck(Map<String, Object> data) {
        Object raw = firstNonNull(get(data, "update.status"), get(data, "status"));
        String statusName = raw instanceof Number ? null : (raw != null ? raw.toString() : null);
        Long statusNumber = raw instanceof Number number ? number.longValue() : null;
        return new AckEvent(
                firstString(data, "key.id", "keyId", "id"),
                receiptStatus(statusName, statusNumber),
                raw != null ? raw.toString() : null,
                getBoolean(data, "key.fromMe") || getBoolean(data, "fromMe"),
                firstString(data, "key.remoteJid", "remoteJid"),
                null,
                MessageContentType.TEXT,
                LocalDateTime.now());
    }

    // ---- Meta Cloud ----

    private List<WebhookEnvelope> parseMeta(Map<String, Object> body) {
        List<WebhookEnvelope> envelopes = new ArrayList<>();
        for (Map<String, Object> entry : getList(body, "entry")) {
            for (Map<String, Object> change : getList(entry, "changes")) {
                Map<String, Object> value = getMap(change, "value");
                if (value == null) {
                    continue;
                }
                String phoneNumberId = getString(value, "metadata.phone_number_id");
                String contactName = null;
                List<Map<String, Object>> contacts = getList(value, "contacts");
                if (!contacts.isEmpty()) {
                    contactName = getString(contacts.get(0), "profile.name");
                }

                List<InboundMessageEvent> messages = new ArrayList<>();
                for (Map<String, Object> msg : getList(value, "messages")) {
                    messages.add(metaMessage(msg, contactName));
                }
                List<AckEvent> acks = new ArrayList<>();
                for (Map<String, Object> status : getList(value, "statuses")) {
                    acks.add(metaStatus(status));
                }
                envelopes.add(new WebhookEnvelope(GatewayProvider.META_CLOUD, getString(change, "field"),
                        phoneNumberId, messages, acks));
            }
        }
        return envelopes;
    }

    private InboundMessageEvent metaMessage(Map<String, Object> msg, String contactName) {
        String type = getString(msg, "type");
        String body;
        String mimeType = null;
        boolean hasMedia = false;
        if ("text".equals(type)) {
            body = getString(msg, "text.body");
        } else if (type != null && get(msg, type) instanceof Map<?, ?>) {
            body = firstString(msg, type + ".caption", type + ".filename");
            mimeType = getString(msg, type + ".mime_type");
            hasMedia = getString(msg, type + ".id") != null;
        } else {
            body = null;
        }

        String from = getString(msg, "from");
        return new InboundMessageEvent(
                getString(msg, "id"),
                false,
                from != null ? ChatIdUtils.buildChatId(from) : null,
                null,
                contactName,
                body,
                "unsupported".equals(type) ? "protocol" : type,
                mimeType,
                null,
                null,
                hasMedia,
                getString(msg, "context.id"),
                epoch(getLong(msg, "timestamp")));
    }

    private AckEvent metaStatus(Map<String, Object> status) {
        String name = getString(status, "status");
        String recipient = getString(status, "recipient_id");
        return new AckEvent(
                getString(status, "id"),
                receiptStatus(name, null),
                name,
                true,
                recipient != null ? ChatIdUtils.buildChatId(recipient) : null,
                null,
                MessageContentType.TEXT,
                epoch(getLong(status, "timestamp")));
    }

    // ---- shared ----

    /**
     * Receipt kinds: 2 / DEVICE / DELIVERY_ACK / delivered map to delivered,
     * 3+ / READ / PLAYED / read / played to read. Anything else is untracked.
     */
    static MessageStatus receiptStatus(String name, Long number) {
        if (name != null) {
            String upper = name.toUpperCase(Locale.ROOT);
            if (DELIVERED_RECEIPTS.contains(upper)) {
                return MessageStatus.DELIVERED;
            }
            if (READ_RECEIPTS.contains(upper)) {
                return MessageStatus.READ;
            }
        }
        if (number == null) {
            return null;
        }
        if (number == 2) {
            return MessageStatus.DELIVERED;
        }
        return number >= 3 ? MessageStatus.READ : null;
    }

    private static LocalDateTime epoch(Long seconds) {
        if (seconds == null || seconds <= 0) {
            return LocalDateTime.now();
        }
        long value = seconds > 100_000_000_000L ? seconds / 1000 : seconds;
        return LocalDateTime.ofInstant(Instant.ofEpochSecond(value), ZoneId.systemDefault());
    }

    private static boolean isBlankOrBinary(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        if (text.length() < 100) {
            return false;
        }
        if (text.startsWith("/9j/") || text.startsWith("iVBOR") || text.startsWith("data:")) {
            return true;
        }
        return text.length() > 500 && !text.contains(" ") && text.substring(0, 100).matches("[A-Za-z0-9+/=]+");
    }

    private static Object firstNonNull(Object a, Object b) {
        return a != null ? a : b;
    }
}
