package com.staybook.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A payment outcome that could not be applied safely. Captured money referenced here
 * needs a compensating action (refund or manual confirmation) before the row is resolved.
 */
@Entity
@Table(name = "reconciliation_conflicts", indexes = {
        @Index(name = "idx_reconciliation_conflicts_status", columnList = "status"),
        @Index(name = "idx_reconciliation_conflicts_reservation", columnList = "reservation_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationConflictRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_key", nullable = false, length = 255)
    private String eventKey;

    @Column(name = "reservation_id", nullable = false, length = 32)
    private String reservationId;

    @Column(name = "payment_attempt_id", nullable = false, length = 32)
    private String paymentAttemptId;

    @Column(name = "external_session_id", length = 255)
    private String externalSessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 32)
    private ConflictReason reason;

    @Column(name = "reported_amount_cents")
    private Long reportedAmountCents;

    @Column(name = "expected_amount_cents")
    private Long expectedAmountCents;

    @Column(name = "reservation_status", length = 16)
    private String reservationStatus;

    @Column(name = "channel", length = 16)
    private String channel;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ConflictStatus status;

    @Column(name = "resolution_note", length = 1000)
    private String resolutionNote;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public enum ConflictReason {
        /** Payment succeeded after the reservation left the live states. */
        LATE_PAYMENT,
        /** A second attempt succeeded for a reservation that is already paid. */
        DUPLICATE_PAYMENT,
        /** Gateway reported an amount different from the attempt snapshot. */
        AMOUNT_MISMATCH
    }

    public enum ConflictStatus {
        OPEN,
        RESOLVED
    }
}
