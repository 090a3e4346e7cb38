package com.staybook.reservation.client.dto;

import com.staybook.reservation.domain.model.PaymentOutcome;

import java.util.Optional;

/**
 * Gateway view of a checkout session.
 *
 * @param status        open, complete or expired
 * @param paymentStatus unpaid, paid or failed
 * @param amountTotal   amount captured or requested, in minor units
 */
public record SessionStatusResponse(
        String sessionId,
        String status,
        String paymentStatus,
        Long amountTotal
) {

    /**
     * Empty while the session can still change.
     */
    public Optional<PaymentOutcome> terminalOutcome() {
        if ("complete".equalsIgnoreCase(status) && "paid".equalsIgnoreCase(paymentStatus)) {
            return Optional.of(PaymentOutcome.SUCCEEDED);
        }
        if ("expired".equalsIgnoreCase(status) || "failed".equalsIgnoreCase(paymentStatus)) {
            return Optional.of(PaymentOutcome.FAILED);
        }
        return Optional.empty();
    }
}
