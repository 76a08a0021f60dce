package com.digitalgroup.zapdesk.integration.whatsapp;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.domain.gateway.service.GatewayConfigService;
import com.digitalgroup.zapdesk.domain.message.service.AckReconcilerService;
import com.digitalgroup.zapdesk.domain.message.service.InboundMessageService;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.AckEvent;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.IgnoreReason;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.InboundMessageEvent;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookPayloadParser;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookResult;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookSignatureVerifier;
import com.digitalgroup.zapdesk.multitenancy.TenantContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WhatsAppWebhookServiceTest {

    @Mock
    private GatewayConfigService gatewayConfigService;

    @Mock
    private InboundMessageService inboundMessageService;

    @Mock
    private AckReconcilerService ackReconcilerService;

    private WhatsAppWebhookService webhookService;
    private GatewayConfig config;

    @BeforeEach
    void setUp() {
        webhookService = new WhatsAppWebhookService(new WebhookPayloadParser(), new WebhookSignatureVerifier(),
                gatewayConfigService, inboundMessageService, ackReconcilerService);
        config = GatewayConfig.builder()
                .id(7L)
                .tenantId(10L)
                .name("Main line")
                .provider(GatewayProvider.WAHA)
                .instanceName("default")
                .phoneNumber("5511900000000")
                .active(true)
                .build();
    }

    private InboundMessageEvent message(String chatId, String body, String type, boolean hasMedia) {
        return new InboundMessageEvent("m1", false, chatId, null, "Maria", body, type, null,
                null, null, hasMedia, null, null);
    }

    private Map<String, Object> wahaMessage(String from, String body) {
        return Map.of(
                "event", "message",
                "session", "default",
                "payload", Map.of("id", "m1", "from", from, "body", body, "_data", Map.of("type", "chat")));
    }

    @Test
    void filter_GroupMessage() {
        assertEquals(IgnoreReason.GROUP_MESSAGE,
                webhookService.filter(config, message("120363040000000000@g.us", "Oi", "chat", false)));
    }

    @Test
    void filter_StatusBroadcast() {
        assertEquals(IgnoreReason.STATUS_BROADCAST,
                webhookService.filter(config, message("status@broadcast", "Oi", "chat", false)));
    }

    @Test
    void filter_OwnNumber() {
        assertEquals(IgnoreReason.SELF_MESSAGE,
                webhookService.filter(config, message("5511900000000@c.us", "Oi", "chat", false)));
    }

    @Test
    void filter_SystemMessage() {
        assertEquals(IgnoreReason.SYSTEM_MESSAGE,
                webhookService.filter(config, message("5545999990000@c.us", null, "e2e_notification", false)));
    }

    @Test
    void filter_EmptyAndPlaceholder() {
        assertEquals(IgnoreReason.EMPTY_MESSAGE,
                webhookService.filter(config, message("5545999990000@c.us", " ", "chat", false)));
        assertEquals(IgnoreReason.PLACEHOLDER_CONTENT,
                webhookService.filter(config, message("5545999990000@c.us", "[Mídia]", "chat", false)));
    }

    @Test
    void filter_MissingChat_IsInvalid() {
        assertEquals(IgnoreReason.INVALID_PAYLOAD,
                webhookService.filter(config, message(null, "Oi", "chat", false)));
    }

    @Test
    void filter_RegularTextAndMedia_Pass() {
        assertNull(webhookService.filter(config, message("5545999990000@c.us", "Olá", "chat", false)));
        assertNull(webhookService.filter(config, message("5545999990000@c.us", null, "image", true)));
    }

    @Test
    void handle_UnknownPayload_IsUnsupported() {
        WebhookResult result = webhookService.handle(Map.of("hello", "world"), "{}", new HttpHeaders());

        assertEquals(IgnoreReason.UNSUPPORTED_EVENT, result.reason());
        verifyNoInteractions(gatewayConfigService);
    }

    @Test
    void handle_UnknownGateway_IsIgnored() {
        when(gatewayConfigService.findForWebhook(GatewayProvider.WAHA, "default")).thenReturn(Optional.empty());

        WebhookResult result = webhookService.handle(wahaMessage("5545999990000@c.us", "Olá"), "{}", new HttpHeaders());

        assertEquals(IgnoreReason.GATEWAY_NOT_FOUND, result.reason());
        verifyNoInteractions(inboundMessageService);
    }

    @Test
    void handle_GroupMessage_NeverReachesPipeline() {
        when(gatewayConfigService.findForWebhook(GatewayProvider.WAHA, "default")).thenReturn(Optional.of(config));

        WebhookResult result = webhookService.handle(wahaMessage("120363040000000000@g.us", "Olá"), "{}",
                new HttpHeaders());

        assertTrue(result.isIgnored());
        assertEquals(IgnoreReason.GROUP_MESSAGE, result.reason());
        verifyNoInteractions(inboundMessageService);
    }

    @Test
    void handle_Message_RunsInGatewayTenant() {
        when(gatewayConfigService.findForWebhook(GatewayProvider.WAHA, "default")).thenReturn(Optional.of(config));
        when(inboundMessageService.process(eq(config), any(InboundMessageEvent.class))).thenAnswer(inv -> {
            assertEquals(10L, TenantContext.getCurrentTenant());
            return WebhookResult.message("m1", 1L, 50L);
        });

        WebhookResult result = webhookService.handle(wahaMessage("5545999990000@c.us", "Olá"), "{}", new HttpHeaders());

        assertEquals("message", result.event());
        assertEquals(50L, result.conversationId());
        assertFalse(TenantContext.hasTenant());
    }

    @Test
    void handle_PipelineFailure_IsReportedNotThrown() {
        when(gatewayConfigService.findForWebhook(GatewayProvider.WAHA, "default")).thenReturn(Optional.of(config));
        when(inboundMessageService.process(eq(config), any(InboundMessageEvent.class)))
                .thenThrow(new IllegalStateException("db down"));

        WebhookResult result = webhookService.handle(wahaMessage("5545999990000@c.us", "Olá"), "{}", new HttpHeaders());

        assertFalse(result.success());
        assertEquals("db down", result.error());
    }

    @Test
    void handle_Ack_GoesToReconciler() {
        Map<String, Object> body = Map.of(
                "event", "message.ack",
                "session", "default",
                "payload", Map.of("id", "3EB0ABC", "fromMe", true, "to", "5545999990000@c.us", "ack", 2));
        when(gatewayConfigService.findForWebhook(GatewayProvider.WAHA, "default")).thenReturn(Optional.of(config));
        when(ackReconcilerService.reconcile(eq(config), any(AckEvent.class)))
                .thenReturn(WebhookResult.ack("delivered", "3EB0ABC"));

        WebhookResult result = webhookService.handle(body, "{}", new HttpHeaders());

        assertEquals("ack", result.event());
        assertEquals("delivered", result.status());
        verifyNoInteractions(inboundMessageService);
    }
}
