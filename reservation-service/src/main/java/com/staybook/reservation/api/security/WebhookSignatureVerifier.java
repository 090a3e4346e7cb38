package com.staybook.reservation.api.security;

import com.staybook.common.util.Constants;
import com.staybook.reservation.exception.InvalidWebhookSignatureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Checks the {@code Payment-Signature} header of a gateway webhook.
 *
 * Header format: {@code t=<unix seconds>,v1=<hex HMAC-SHA256>}, where the MAC covers
 * {@code <t>.<raw request body>} under the shared webhook secret. Several {@code v1} entries
 * are accepted so the gateway can roll its secret.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookSignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final Clock clock;

    @Value("${stay.payment.webhook-secret:}")
    private String webhookSecret;

    @Value("${stay.payment.webhook-tolerance-seconds:300}")
    private long toleranceSeconds;

    /**
     * @throws InvalidWebhookSignatureException when the payload cannot be trusted
     */
    public void verify(String payload, String signatureHeader) {
        if (webhookSecret == null || webhookSecret.isBlank()) {
            log.error("Payment webhook rejected: stay.payment.webhook-secret is not configured");
            throw new InvalidWebhookSignatureException("Webhook signing secret is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new InvalidWebhookSignatureException("Missing " + Constants.HEADER_PAYMENT_SIGNATURE + " header");
        }

        Long timestamp = null;
        List<String> signatures = new ArrayList<>();
        for (String part : signatureHeader.split(",")) {
            String[] pair = part.trim().split("=", 2);
            if (pair.length != 2) {
                continue;
            }
            if ("t".equals(pair[0])) {
                timestamp = parseTimestamp(pair[1]);
            } else if ("v1".equals(pair[0])) {
                signatures.add(pair[1]);
            }
        }
        if (timestamp == null || signatures.isEmpty()) {
            throw new InvalidWebhookSignatureException("Malformed " + Constants.HEADER_PAYMENT_SIGNATURE + " header");
        }
        if (Math.abs(clock.instant().getEpochSecond() - timestamp) > toleranceSeconds) {
            throw new InvalidWebhookSignatureException("Webhook signature timestamp outside the accepted window");
        }

        byte[] expected = hmac(timestamp + "." + payload);
        for (String candidate : signatures) {
            if (MessageDigest.isEqual(expected, decodeHex(candidate))) {
                return;
            }
        }
        log.warn("Payment webhook signature mismatch (t={})", timestamp);
        throw new InvalidWebhookSignatureException("Invalid webhook signature");
    }

    private byte[] hmac(String signedPayload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(webhookSecret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(signedPayload.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static Long parseTimestamp(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new InvalidWebhookSignatureException("Malformed signature timestamp");
        }
    }

    private static byte[] decodeHex(String value) {
        try {
            return HexFormat.of().parseHex(value);
        } catch (IllegalArgumentException e) {
            return new byte[0];
        }
    }
}
