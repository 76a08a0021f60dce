package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.common.enums.GatewayProvider;
import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.exception.WebhookVerificationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private static final String BODY = "{\"event\":\"message\",\"session\":\"default\"}";
    private static final String SECRET = "s3cr3t";

    private WebhookSignatureVerifier verifier;
    private GatewayConfig config;

    @BeforeEach
    void setUp() {
        verifier = new WebhookSignatureVerifier();
        config = GatewayConfig.builder()
                .id(1L)
                .tenantId(10L)
                .name("Main line")
                .provider(GatewayProvider.WAHA)
                .webhookSecret(SECRET)
                .build();
    }

    private HttpHeaders signed(String header, String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(header, value);
        return headers;
    }

    @Test
    void verify_PrefixedSignature_IsValid() {
        String signature = "sha256=" + WebhookSignatureVerifier.sign(BODY, SECRET);

        assertEquals(WebhookSignatureVerifier.Outcome.VALID,
                verifier.verify(config, BODY, signed("X-Hub-Signature-256", signature)));
    }

    @Test
    void verify_BareUppercaseSignature_IsValid() {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET).toUpperCase();

        assertEquals(WebhookSignatureVerifier.Outcome.VALID,
                verifier.verify(config, BODY, signed("X-Webhook-Signature", signature)));
    }

    @Test
    void verify_WrongSignature_IsInvalidButAccepted() {
        String signature = WebhookSignatureVerifier.sign(BODY, "other-secret");

        assertEquals(WebhookSignatureVerifier.Outcome.INVALID,
                verifier.verify(config, BODY, signed("X-Signature", signature)));
    }

    @Test
    void verify_NoHeader_IsMissing() {
        assertEquals(WebhookSignatureVerifier.Outcome.MISSING, verifier.verify(config, BODY, new HttpHeaders()));
    }

    @Test
    void verify_Enforced_RejectsBadSignature() {
        ReflectionTestUtils.setField(verifier, "enforce", true);

        assertThrows(WebhookVerificationException.class,
                () -> verifier.verify(config, BODY, signed("X-Signature", "deadbeef")));
    }

    @Test
    void verify_Enforced_AcceptsValidSignature() {
        ReflectionTestUtils.setField(verifier, "enforce", true);
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);

        assertEquals(WebhookSignatureVerifier.Outcome.VALID,
                verifier.verify(config, BODY, signed("X-Waha-Signature", signature)));
    }

    @Test
    void verify_NoSecret_IsNotConfigured() {
        config.setWebhookSecret(null);
        ReflectionTestUtils.setField(verifier, "enforce", true);

        assertEquals(WebhookSignatureVerifier.Outcome.NOT_CONFIGURED,
                verifier.verify(config, BODY, new HttpHeaders()));
    }

    @Test
    void matches_TamperedBody_Fails() {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);

        assertTrue(WebhookSignatureVerifier.matches(BODY, signature, SECRET));
        assertFalse(WebhookSignatureVerifier.matches(BODY + " ", signature, SECRET));
    }
}
