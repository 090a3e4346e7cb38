package com.staybook.reservation.client.dto;

public record CreateCheckoutSessionRequest(
        String reservationId,
        String paymentAttemptId,
        long amountCents,
        String currency,
        long expiresInSeconds,
        String idempotencyKey
) {
}
