package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.model.PaymentEvent;
import com.staybook.reservation.domain.model.PaymentOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Payment outcome pushed by the gateway.
 */
public record PaymentWebhookRequest(
        @NotBlank(message = "Event ID cannot be blank")
        String eventId,

        @NotBlank(message = "Session ID cannot be blank")
        String sessionId,

        @NotNull(message = "Outcome cannot be null")
        PaymentOutcome outcome,

        @NotNull(message = "Amount cannot be null")
        @PositiveOrZero(message = "Amount cannot be negative")
        Long amountCents
) {
    public PaymentEvent toEvent() {
        return new PaymentEvent(eventId, sessionId, outcome, amountCents);
    }
}
