package com.tenantbill.backend.services.billing;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Stripe-Signature} header: lowercase hex HMAC-SHA256 of the raw body
 * keyed with the configured webhook secret.
 *
 * With no secret configured every delivery is accepted (local development only).
 */
@Component
@Slf4j
public class WebhookSignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final String webhookSecret;

    public WebhookSignatureVerifier(@Value("${stripe.webhook.secret:}") String webhookSecret) {
        this.webhookSecret = webhookSecret;
    }

    @PostConstruct
    void logMode() {
        if (isPermissive()) {
            log.warn("stripe.webhook.secret is not set: webhook signatures will NOT be verified");
        } else {
            log.info("Webhook signature verification enabled");
        }
    }

    public boolean isPermissive() {
        return webhookSecret == null || webhookSecret.isEmpty();
    }

    public boolean verify(byte[] rawBody, String signatureHeader) {
        if (isPermissive()) {
            return true;
        }
        if (signatureHeader == null || signatureHeader.isEmpty()) {
            return false;
        }

        String expected = sign(rawBody, webhookSecret);
        // Constant-time comparison
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signatureHeader.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Lowercase hex HMAC-SHA256 of the body
     */
    public static String sign(byte[] rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(rawBody));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Unable to compute webhook signature", e);
        }
    }
}
