package com.staybook.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One checkout session opened against a reservation. The unique
 * (reservation_id, attempt_number) key keeps attempt numbers strictly increasing
 * even when two attempts are requested at once.
 */
@Entity
@Table(name = "payment_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_payment_attempts_reservation_number",
                columnNames = {"reservation_id", "attempt_number"}),
        indexes = {
                @Index(name = "idx_payment_attempts_session", columnList = "external_session_id"),
                @Index(name = "idx_payment_attempts_status", columnList = "status")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentAttempt {

    @Id
    @Column(name = "id", length = 32)
    private String id;

    @Column(name = "reservation_id", nullable = false, length = 32)
    private String reservationId;

    @Column(name = "attempt_number", nullable = false)
    private Integer attemptNumber;

    @Column(name = "external_session_id", length = 255)
    private String externalSessionId;

    @Column(name = "checkout_url", length = 2048)
    private String checkoutUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private AttemptStatus status;

    @Column(name = "amount_cents", nullable = false)
    private Long amountCents;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "attempt_expires_at")
    private LocalDateTime attemptExpiresAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public boolean isOpen() {
        return status == AttemptStatus.CREATED || status == AttemptStatus.PROCESSING;
    }

    public enum AttemptStatus {
        CREATED,
        PROCESSING,
        SUCCEEDED,
        FAILED,
        EXPIRED
    }
}
