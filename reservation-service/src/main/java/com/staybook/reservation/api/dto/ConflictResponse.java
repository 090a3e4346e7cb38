package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.model.ReconciliationConflictRecord;

import java.time.LocalDateTime;

public record ConflictResponse(
        Long id,
        String eventKey,
        String reservationId,
        String paymentAttemptId,
        String externalSessionId,
        ReconciliationConflictRecord.ConflictReason reason,
        Long reportedAmountCents,
        Long expectedAmountCents,
        String reservationStatus,
        String channel,
        ReconciliationConflictRecord.ConflictStatus status,
        String resolutionNote,
        LocalDateTime createdAt,
        LocalDateTime resolvedAt
) {
    public static ConflictResponse from(ReconciliationConflictRecord conflict) {
        return new ConflictResponse(
                conflict.getId(),
                conflict.getEventKey(),
                conflict.getReservationId(),
                conflict.getPaymentAttemptId(),
                conflict.getExternalSessionId(),
                conflict.getReason(),
                conflict.getReportedAmountCents(),
                conflict.getExpectedAmountCents(),
                conflict.getReservationStatus(),
                conflict.getChannel(),
                conflict.getStatus(),
                conflict.getResolutionNote(),
                conflict.getCreatedAt(),
                conflict.getResolvedAt()
        );
    }
}
