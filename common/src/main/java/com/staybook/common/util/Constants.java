package com.staybook.common.util;

/**
 * Header names and key prefixes shared across the engine.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String HEADER_GUEST_ID = "X-Guest-Id";
    public static final String HEADER_IDEMPOTENCY_KEY = "Idempotency-Key";
    public static final String HEADER_PAYMENT_SIGNATURE = "Payment-Signature";

    public static final String RESERVATION_ID_PREFIX = "RES-";
    public static final String PAYMENT_ATTEMPT_ID_PREFIX = "PAY-";
    public static final String POLL_EVENT_KEY_PREFIX = "poll:";
    public static final String POLL_THROTTLE_PREFIX = "throttle:poll:";
    public static final String IDEMPOTENCY_CACHE_PREFIX = "idempotency:";
}
