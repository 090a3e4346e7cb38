package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.service.ReconciliationResult;

public record WebhookAckResponse(
        String eventKey,
        String disposition,
        String recordedOutcome,
        String reservationId,
        String reservationStatus,
        Long conflictId
) {
    public static WebhookAckResponse from(ReconciliationResult result) {
        return new WebhookAckResponse(
                result.eventKey(),
                result.disposition().name(),
                result.recordedOutcome(),
                result.reservationId(),
                result.reservationStatus(),
                null
        );
    }

    /**
     * The event was stored but could not be applied; acknowledged so the gateway stops redelivering.
     */
    public static WebhookAckResponse conflict(String eventKey, String reservationId, Long conflictId) {
        return new WebhookAckResponse(eventKey, "CONFLICT", "CONFLICT", reservationId, null, conflictId);
    }
}
