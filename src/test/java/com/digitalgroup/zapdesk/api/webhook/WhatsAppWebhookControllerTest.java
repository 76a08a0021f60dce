package com.digitalgroup.zapdesk.api.webhook;

import com.digitalgroup.zapdesk.exception.WebhookVerificationException;
import com.digitalgroup.zapdesk.integration.whatsapp.WhatsAppWebhookService;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.IgnoreReason;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookResult;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class WhatsAppWebhookControllerTest {

    private static final String WAHA_MESSAGE = """
            {"event":"message","session":"default",
             "payload":{"id":"m1","from":"5545999990000@c.us","body":"Olá"}}
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WhatsAppWebhookService webhookService;

    @Test
    void verifyWebhook_MatchingToken_EchoesChallenge() throws Exception {
        mockMvc.perform(get("/whatsapp_webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "test-verify-token")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isOk())
                .andExpect(content().string("1158201444"));
    }

    @Test
    void verifyWebhook_WrongToken_IsForbidden() throws Exception {
        mockMvc.perform(get("/whatsapp_webhook")
                        .param("hub.mode", "subscribe")
                        .param("hub.verify_token", "guess")
                        .param("hub.challenge", "1158201444"))
                .andExpect(status().isForbidden())
                .andExpect(content().string("Verification failed"));
    }

    @Test
    void handleWebhook_Message_ReturnsResult() throws Exception {
        when(webhookService.handle(anyMap(), anyString(), any()))
                .thenReturn(WebhookResult.message("m1", 1L, 50L));

        mockMvc.perform(post("/whatsapp_webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(WAHA_MESSAGE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.event").value("message"))
                .andExpect(jsonPath("$.conversationId").value(50));
    }

    @Test
    void handleWebhook_UnreadableBody_IsIgnoredWith200() throws Exception {
        mockMvc.perform(post("/whatsapp_webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ignored").value(true))
                .andExpect(jsonPath("$.reason").value(IgnoreReason.INVALID_PAYLOAD));

        verifyNoInteractions(webhookService);
    }

    @Test
    void handleWebhook_UnexpectedFailure_Still200() throws Exception {
        when(webhookService.handle(anyMap(), anyString(), any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/whatsapp_webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(WAHA_MESSAGE))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("boom"));
    }

    @Test
    void handleWebhook_EnforcedSignatureFailure_IsForbidden() throws Exception {
        when(webhookService.handle(anyMap(), anyString(), any()))
                .thenThrow(new WebhookVerificationException("Webhook signature invalid"));

        mockMvc.perform(post("/whatsapp_webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(WAHA_MESSAGE))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.success").value(false));
    }
}
