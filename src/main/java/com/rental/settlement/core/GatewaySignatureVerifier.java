package com.rental.settlement.core;

import com.rental.settlement.config.GatewayProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 checks for gateway callbacks. Checkout signatures are keyed with the API key
 * secret over {@code orderId|paymentId}; webhook signatures are keyed with the separate
 * webhook secret over the raw request body. Comparisons are constant-time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewaySignatureVerifier {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private final GatewayProperties properties;

    public boolean verifyPaymentSignature(String externalOrderId, String externalPaymentId, String signature) {
        if (externalOrderId == null || externalPaymentId == null) {
            return false;
        }
        String secret = properties.getKeySecret();
        if (secret == null || secret.isBlank()) {
            log.error("Gateway key secret is not configured; rejecting payment signature");
            return false;
        }
        String expected = hmacHex(secret, externalOrderId + "|" + externalPaymentId);
        return constantTimeEquals(expected, signature);
    }

    public boolean verifyWebhookSignature(String rawBody, String signature) {
        if (rawBody == null) {
            return false;
        }
        String secret = properties.getWebhookSecret();
        if (secret == null || secret.isBlank()) {
            log.error("Gateway webhook secret is not configured; rejecting webhook");
            return false;
        }
        return constantTimeEquals(hmacHex(secret, rawBody), signature);
    }

    static String hmacHex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static boolean constantTimeEquals(String expectedHex, String providedHex) {
        if (providedHex == null || providedHex.isBlank()) {
            return false;
        }
        byte[] expected = expectedHex.getBytes(StandardCharsets.US_ASCII);
        byte[] provided = providedHex.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(expected, provided);
    }
}
