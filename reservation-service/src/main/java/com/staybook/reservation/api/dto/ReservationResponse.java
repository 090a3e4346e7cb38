package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.model.Reservation;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record ReservationResponse(
        String id,
        String guestId,
        LocalDate checkIn,
        LocalDate checkOut,
        Integer guestCount,
        Integer nights,
        Long nightlyRateCents,
        Long cleaningFeeCents,
        Long totalAmountCents,
        Reservation.ReservationStatus status,
        Reservation.PaymentStatus paymentStatus,
        LocalDateTime holdExpiresAt,
        Long refundAmountCents,
        String cancellationReason,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {
    public static ReservationResponse from(Reservation reservation) {
        return new ReservationResponse(
                reservation.getId(),
                reservation.getGuestId(),
                reservation.getCheckIn(),
                reservation.getCheckOut(),
                reservation.getGuestCount(),
                reservation.getNights(),
                reservation.getNightlyRateCents(),
                reservation.getCleaningFeeCents(),
                reservation.getTotalAmountCents(),
                reservation.getStatus(),
                reservation.getPaymentStatus(),
                reservation.getHoldExpiresAt(),
                reservation.getRefundAmountCents(),
                reservation.getCancellationReason(),
                reservation.getCreatedAt(),
                reservation.getUpdatedAt()
        );
    }
}
