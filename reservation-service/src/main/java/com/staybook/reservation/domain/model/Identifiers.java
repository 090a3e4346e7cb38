package com.staybook.reservation.domain.model;

import com.staybook.common.util.Constants;

import java.util.Locale;
import java.util.UUID;

/**
 * Public identifiers: a type prefix followed by 12 upper-case hex digits.
 */
public final class Identifiers {
    private Identifiers() {
        // Utility class
    }

    public static String newReservationId() {
        return Constants.RESERVATION_ID_PREFIX + randomHex(12);
    }

    public static String newPaymentAttemptId() {
        return Constants.PAYMENT_ATTEMPT_ID_PREFIX + randomHex(12);
    }

    public static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }
}
