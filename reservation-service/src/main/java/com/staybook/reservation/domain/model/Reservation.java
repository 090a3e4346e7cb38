package com.staybook.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A guest's claim on a date range. Rows are never deleted; terminal states
 * (cancelled, expired, completed) are kept for audit.
 */
@Entity
@Table(name = "reservations", indexes = {
        @Index(name = "idx_reservations_guest", columnList = "guest_id"),
        @Index(name = "idx_reservations_status_hold", columnList = "status,hold_expires_at")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    @Id
    @Column(name = "id", length = 32)
    private String id;

    @Column(name = "guest_id", nullable = false, length = 128)
    private String guestId;

    @Column(name = "check_in", nullable = false)
    private LocalDate checkIn;

    @Column(name = "check_out", nullable = false)
    private LocalDate checkOut;

    @Column(name = "guest_count", nullable = false)
    private Integer guestCount;

    @Column(name = "nights", nullable = false)
    private Integer nights;

    @Column(name = "nightly_rate_cents", nullable = false)
    private Long nightlyRateCents;

    @Column(name = "cleaning_fee_cents", nullable = false)
    private Long cleaningFeeCents;

    @Column(name = "total_amount_cents", nullable = false)
    private Long totalAmountCents;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ReservationStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 16)
    private PaymentStatus paymentStatus;

    @Column(name = "hold_expires_at")
    private LocalDateTime holdExpiresAt;

    @Column(name = "refund_amount_cents")
    private Long refundAmountCents;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public DateRange dateRange() {
        return DateRange.of(checkIn, checkOut);
    }

    public boolean isOwnedBy(String guest) {
        return guestId.equals(guest);
    }

    /**
     * Pending and still inside its hold window.
     */
    public boolean isHoldActive(LocalDateTime now) {
        return status == ReservationStatus.PENDING && holdExpiresAt != null && holdExpiresAt.isAfter(now);
    }

    public enum ReservationStatus {
        PENDING,
        CONFIRMED,
        CANCELLED,
        EXPIRED,
        COMPLETED;

        public boolean isTerminal() {
            return this == CANCELLED || this == EXPIRED || this == COMPLETED;
        }
    }

    /**
     * Allowed moves: NONE→PENDING, PENDING→PAID|FAILED, FAILED→PENDING, PAID→REFUNDED.
     */
    public enum PaymentStatus {
        NONE,
        PENDING,
        PAID,
        FAILED,
        REFUNDED;

        public boolean canMoveTo(PaymentStatus next) {
            return switch (this) {
                case NONE -> next == PENDING;
                case PENDING -> next == PAID || next == FAILED;
                case FAILED -> next == PENDING;
                case PAID -> next == REFUNDED;
                case REFUNDED -> false;
            };
        }
    }
}
