package com.digitalgroup.zapdesk.integration.whatsapp.webhook;

import com.digitalgroup.zapdesk.domain.gateway.entity.GatewayConfig;
import com.digitalgroup.zapdesk.exception.WebhookVerificationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * HMAC-SHA256 check of the raw webhook body against the gateway's secret.
 * By default a bad or missing signature is only logged; with
 * {@code zapdesk.webhook.signature.enforce} it rejects the delivery.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGO = "HmacSHA256";
    private static final String PREFIX = "sha256=";
    static final List<String> SIGNATURE_HEADERS = List.of(
            "X-Webhook-Signature", "X-Hub-Signature-256", "X-Signature", "X-Waha-Signature");

    public enum Outcome {
        VALID,
        INVALID,
        MISSING,
        NOT_CONFIGURED
    }

    @Value("${zapdesk.webhook.signature.enforce:false}")
    private boolean enforce;

    /**
     * @throws WebhookVerificationException when enforcement is on and the signature is missing or wrong
     */
    public Outcome verify(GatewayConfig config, String rawBody, HttpHeaders headers) {
        if (!config.hasWebhookSecret()) {
            return Outcome.NOT_CONFIGURED;
        }

        String signature = findSignature(headers);
        Outcome outcome;
        if (signature == null) {
            outcome = Outcome.MISSING;
        } else {
            outcome = matches(rawBody, signature, config.getWebhookSecret()) ? Outcome.VALID : Outcome.INVALID;
        }

        if (outcome != Outcome.VALID) {
            if (enforce) {
                log.warn("Rejecting webhook for gateway {}: signature {}", config.getName(), outcome);
                throw new WebhookVerificationException("Webhook signature " + outcome.name().toLowerCase(Locale.ROOT));
            }
            log.warn("Webhook signature {} for gateway {}, processing anyway", outcome, config.getName());
        }
        return outcome;
    }

    private String findSignature(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        for (String name : SIGNATURE_HEADERS) {
            String value = headers.getFirst(name);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    static boolean matches(String rawBody, String signature, String secret) {
        String received = signature.startsWith(PREFIX) ? signature.substring(PREFIX.length()) : signature;
        String expected = sign(rawBody, secret);
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                received.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Hex HMAC-SHA256 of the body, without the sha256= prefix.
     */
    public static String sign(String rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGO);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGO));
            byte[] digest = mac.doFinal((rawBody != null ? rawBody : "").getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
