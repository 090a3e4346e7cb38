package com.staybook.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Money was captured (or reported) in a way the engine could not apply.
 * Consumers are expected to refund or escalate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationConflictEvent {
    private Long conflictId;
    private String reservationId;
    private String paymentAttemptId;
    private String externalSessionId;
    private String reason;
    private String reservationStatus;
    private Long reportedAmountCents;
    private Long expectedAmountCents;
    private Instant timestamp;
}
