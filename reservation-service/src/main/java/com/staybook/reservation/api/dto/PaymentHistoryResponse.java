package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.Reservation;

import java.util.List;

public record PaymentHistoryResponse(
        String reservationId,
        Reservation.PaymentStatus paymentStatus,
        int attemptCount,
        int remainingAttempts,
        PaymentAttempt.AttemptStatus latestStatus,
        List<PaymentAttemptResponse> attempts
) {
    public static PaymentHistoryResponse of(Reservation reservation, List<PaymentAttempt> attempts, int maxAttempts) {
        int used = attempts.stream().mapToInt(PaymentAttempt::getAttemptNumber).max().orElse(0);
        PaymentAttempt.AttemptStatus latest = attempts.isEmpty() ? null : attempts.get(attempts.size() - 1).getStatus();
        return new PaymentHistoryResponse(
                reservation.getId(),
                reservation.getPaymentStatus(),
                attempts.size(),
                Math.max(0, maxAttempts - used),
                latest,
                attempts.stream().map(PaymentAttemptResponse::from).toList()
        );
    }
}
