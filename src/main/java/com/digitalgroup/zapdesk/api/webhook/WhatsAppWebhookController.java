package com.digitalgroup.zapdesk.api.webhook;

import com.digitalgroup.zapdesk.exception.WebhookVerificationException;
import com.digitalgroup.zapdesk.integration.whatsapp.WhatsAppWebhookService;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.IgnoreReason;
import com.digitalgroup.zapdesk.integration.whatsapp.webhook.WebhookResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * WhatsApp Webhook Controller
 * Single entry point for every gateway dialect (WAHA, Evolution, Meta Cloud)
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class WhatsAppWebhookController {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};

    private final WhatsAppWebhookService webhookService;
    private final ObjectMapper objectMapper;

    @Value("${whatsapp.webhook-verify-token}")
    private String verifyToken;

    /**
     * Webhook verification endpoint (GET)
     * Meta calls this to verify the webhook URL
     */
    @GetMapping("/whatsapp_webhook")
    public ResponseEntity<String> verifyWebhook(
            @RequestParam(name = "hub.mode") String mode,
            @RequestParam(name = "hub.verify_token") String token,
            @RequestParam(name = "hub.challenge") String challenge) {

        log.info("WhatsApp webhook verification request received");

        if ("subscribe".equals(mode) && verifyToken.equals(token)) {
            log.info("WhatsApp webhook verified successfully");
            return ResponseEntity.ok(challenge);
        }

        log.warn("WhatsApp webhook verification failed");
        return ResponseEntity.status(403).body("Verification failed");
    }

    /**
     * Webhook event handler (POST)
     * Always answers 200 so gateways do not redeliver; only an enforced
     * signature failure is turned into a 403 by the exception handler.
     */
    @PostMapping("/whatsapp_webhook")
    public ResponseEntity<WebhookResult> handleWebhook(@RequestBody String rawBody,
                                                       @RequestHeader HttpHeaders headers) {
        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(rawBody, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring webhook with unreadable body: {}", e.getOriginalMessage());
            return ResponseEntity.ok(WebhookResult.ignored(IgnoreReason.INVALID_PAYLOAD));
        }
        if (payload == null) {
            return ResponseEntity.ok(WebhookResult.ignored(IgnoreReason.INVALID_PAYLOAD));
        }

        try {
            WebhookResult result = webhookService.handle(payload, rawBody, headers);
            log.debug("Webhook handled: {}", result);
            return ResponseEntity.ok(result);
        } catch (WebhookVerificationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error processing WhatsApp webhook: {}", e.getMessage(), e);
            return ResponseEntity.ok(WebhookResult.failed(e.getMessage()));
        }
    }
}
