package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.model.PaymentAttempt;

import java.time.LocalDateTime;

public record PaymentAttemptResponse(
        String id,
        String reservationId,
        Integer attemptNumber,
        PaymentAttempt.AttemptStatus status,
        Long amountCents,
        String currency,
        String checkoutUrl,
        String externalSessionId,
        LocalDateTime attemptExpiresAt,
        LocalDateTime createdAt
) {
    public static PaymentAttemptResponse from(PaymentAttempt attempt) {
        return new PaymentAttemptResponse(
                attempt.getId(),
                attempt.getReservationId(),
                attempt.getAttemptNumber(),
                attempt.getStatus(),
                attempt.getAmountCents(),
                attempt.getCurrency(),
                attempt.getCheckoutUrl(),
                attempt.getExternalSessionId(),
                attempt.getAttemptExpiresAt(),
                attempt.getCreatedAt()
        );
    }
}
