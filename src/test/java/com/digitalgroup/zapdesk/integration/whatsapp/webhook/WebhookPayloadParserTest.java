package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.common.enums.MessageContentType;
import com.digitalgroup.zapdesk.domain.common.enums.MessageStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser();

    @Test
    void parse_WahaMessage() {
        Map<String, Object> body = Map.of(
                "event", "message",
                "session", "default",
                "payload", Map.of(
                        "id", "false_5545999990000@c.us_3EB0ABC",
                        "from", "5545999990000@c.us",
                        "fromMe", false,
                        "body", "Olá",
                        "timestamp", 1714564800,
                        "_data", Map.of("type", "chat", "notifyName", "Maria")));

        List<WebhookEnvelope> envelopes = parser.parse(body);

        assertEquals(1, envelopes.size());
        WebhookEnvelope envelope = envelopes.get(0);
        assertEquals(GatewayProvider.WAHA, envelope.provider());
        assertEquals("default", envelope.instanceKey());
        InboundMessageEvent message = envelope.messages().get(0);
        assertEquals("false_5545999990000@c.us_3EB0ABC", message.messageId());
        assertEquals("5545999990000@c.us", message.chatId());
        assertEquals("Olá", message.body());
        assertEquals("Maria", message.senderName());
        assertEquals(MessageContentType.TEXT, message.contentType());
        assertFalse(message.fromMe());
    }

    @Test
    void parse_WahaFromMe_UsesRecipientAsChat() {
        Map<String, Object> body = Map.of(
                "event", "message.any",
                "session", "default",
                "payload", Map.of(
                        "id", "true_5545999990000@c.us_3EB0ABD",
                        "from", "5511900000000@c.us",
                        "to", "5545999990000@c.us",
                        "fromMe", true,
                        "body", "Resposta"));

        InboundMessageEvent message = parser.parse(body).get(0).messages().get(0);

        assertTrue(message.fromMe());
        assertEquals("5545999990000@c.us", message.chatId());
    }

    @Test
    void parse_WahaMaskedSender_FindsAlternatePhone() {
        Map<String, Object> body = Map.of(
                "event", "message",
                "session", "default",
                "payload", Map.of(
                        "id", "m1",
                        "from", "123456789012345@lid",
                        "body", "Oi",
                        "_data", Map.of("key", Map.of("remoteJidAlt", "5545999990000@s.whatsapp.net"))));

        InboundMessageEvent message = parser.parse(body).get(0).messages().get(0);

        assertEquals("123456789012345@lid", message.chatId());
        assertEquals("5545999990000", message.alternatePhone());
    }

    @Test
    void parse_WahaVoiceNote_IsAudioMedia() {
        Map<String, Object> body = Map.of(
                "event", "message",
                "session", "default",
                "payload", Map.of(
                        "id", "m2",
                        "from", "5545999990000@c.us",
                        "hasMedia", true,
                        "media", Map.of("url", "https://waha/files/m2.oga", "mimetype", "audio/ogg; codecs=opus"),
                        "_data", Map.of("type", "ptt")));

        InboundMessageEvent message = parser.parse(body).get(0).messages().get(0);

        assertEquals(MessageContentType.AUDIO, message.contentType());
        assertEquals("https://waha/files/m2.oga", message.mediaUrl());
        assertTrue(message.carriesMedia());
        assertFalse(message.hasBody());
    }

    @Test
    void parse_WahaInlineMedia_KeepsBase64() {
        Map<String, Object> body = Map.of(
                "event", "message",
                "session", "default",
                "payload", Map.of(
                        "id", "m3",
                        "from", "5545999990000@c.us",
                        "hasMedia", true,
                        "media", Map.of("data", "iVBORw0KGgo=", "mimetype", "image/png"),
                        "_data", Map.of("type", "image")));

        InboundMessageEvent message = parser.parse(body).get(0).messages().get(0);

        assertNull(message.mediaUrl());
        assertEquals("iVBORw0KGgo=", message.mediaData());
        assertEquals(MessageContentType.IMAGE, message.contentType());
    }

    @Test
    void parse_WahaAck() {
        Map<String, Object> body = Map.of(
                "event", "message.ack",
                "session", "default",
                "payload", Map.of(
                        "id", "true_5545999990000@c.us_3EB0ABC",
                        "to", "5545999990000@c.us",
                        "fromMe", true,
                        "ack", 3,
                        "ackName", "READ"));

        WebhookEnvelope envelope = parser.parse(body).get(0);

        assertTrue(envelope.messages().isEmpty());
        AckEvent ack = envelope.acks().get(0);
        assertEquals(MessageStatus.READ, ack.status());
        assertEquals("5545999990000@c.us", ack.recipientId());
        assertTrue(ack.fromMe());
    }

    @Test
    void parse_EvolutionUpsertWithImage() {
        Map<String, Object> body = Map.of(
                "event", "MESSAGES_UPSERT",
                "instance", "loja-1",
                "data", Map.of(
                        "key", Map.of("id", "ABCD", "remoteJid", "5545999990000@s.whatsapp.net", "fromMe", false),
                        "pushName", "Maria",
                        "messageType", "imageMessage",
                        "message", Map.of("imageMessage", Map.of(
                                "url", "https://mmg.whatsapp.net/x.jpg",
                                "mimetype", "image/jpeg",
                                "caption", "Foto")),
                        "messageTimestamp", 1714564800));

        WebhookEnvelope envelope = parser.parse(body).get(0);

        assertEquals(GatewayProvider.EVOLUTION, envelope.provider());
        assertEquals("messages.upsert", envelope.eventName());
        assertEquals("loja-1", envelope.instanceKey());
        InboundMessageEvent message = envelope.messages().get(0);
        assertEquals(MessageContentType.IMAGE, message.contentType());
        assertEquals("Foto", message.body());
        assertEquals("5545999990000@s.whatsapp.net", message.chatId());
    }

    @Test
    void parse_EvolutionReaction_IsSystem() {
        Map<String, Object> body = Map.of(
                "event", "messages.upsert",
                "instance", "loja-1",
                "data", Map.of(
                        "key", Map.of("id", "R1", "remoteJid", "5545999990000@s.whatsapp.net"),
                        "messageType", "reactionMessage",
                        "message", Map.of("reactionMessage", Map.of("text", "👍"))));

        assertTrue(parser.parse(body).get(0).messages().get(0).isSystem());
    }

    @Test
    void parse_EvolutionUpdate_MapsStatus() {
        Map<String, Object> body = Map.of(
                "event", "messages.update",
                "instance", "loja-1",
                "data", Map.of(
                        "key", Map.of("id", "ABCD", "remoteJid", "5545999990000@s.whatsapp.net", "fromMe", true),
                        "update", Map.of("status", "DELIVERY_ACK")));

        AckEvent ack = parser.parse(body).get(0).acks().get(0);

        assertEquals("ABCD", ack.messageId());
        assertEquals(MessageStatus.DELIVERED, ack.status());
    }

    @Test
    void parse_MetaMessagesAndStatuses() {
        Map<String, Object> value = Map.of(
                "metadata", Map.of("phone_number_id", "10987654321"),
                "contacts", List.of(Map.of("profile", Map.of("name", "Maria"))),
                "messages", List.of(Map.of(
                        "id", "wamid.IN1",
                        "from", "5545999990000",
                        "type", "text",
                        "text", Map.of("body", "Olá"),
                        "timestamp", "1714564800")),
                "statuses", List.of(Map.of(
                        "id", "wamid.OUT1",
                        "status", "read",
                        "recipient_id", "5545999990000")));
        Map<String, Object> body = Map.of(
                "object", "whatsapp_business_account",
                "entry", List.of(Map.of("changes", List.of(Map.of("field", "messages", "value", value)))));

        WebhookEnvelope envelope = parser.parse(body).get(0);

        assertEquals(GatewayProvider.META_CLOUD, envelope.provider());
        assertEquals("10987654321", envelope.instanceKey());
        InboundMessageEvent message = envelope.messages().get(0);
        assertEquals("5545999990000@c.us", message.chatId());
        assertEquals("Maria", message.senderName());
        assertEquals("Olá", message.body());
        AckEvent ack = envelope.acks().get(0);
        assertEquals(MessageStatus.READ, ack.status());
        assertEquals("5545999990000@c.us", ack.recipientId());
    }

    @Test
    void parse_UnknownShape_ReturnsNothing() {
        assertTrue(parser.parse(Map.of("foo", "bar")).isEmpty());
        assertTrue(parser.parse(Map.of()).isEmpty());
    }

    @Test
    void receiptStatus_Mapping() {
        assertEquals(MessageStatus.DELIVERED, WebhookPayloadParser.receiptStatus("DEVICE", null));
        assertEquals(MessageStatus.DELIVERED, WebhookPayloadParser.receiptStatus(null, 2L));
        assertEquals(MessageStatus.READ, WebhookPayloadParser.receiptStatus("played", null));
        assertEquals(MessageStatus.READ, WebhookPayloadParser.receiptStatus(null, 4L));
        assertNull(WebhookPayloadParser.receiptStatus("SERVER", 1L));
        assertNull(WebhookPayloadParser.receiptStatus("ERROR", -1L));
    }
}
