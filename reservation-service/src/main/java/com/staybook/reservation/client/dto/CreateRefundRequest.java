package com.staybook.reservation.client.dto;

public record CreateRefundRequest(
        String sessionId,
        String reservationId,
        long amountCents,
        String idempotencyKey
) {
}
