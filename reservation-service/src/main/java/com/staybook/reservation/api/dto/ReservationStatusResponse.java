package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.model.Reservation;

import java.time.LocalDateTime;

/**
 * Answer to a status poll.
 *
 * @param throttled        the gateway was not asked because the previous poll was too recent
 * @param gatewayChecked   the gateway was asked during this poll
 * @param conflictRecorded the gateway reported a payment that could not be applied
 */
public record ReservationStatusResponse(
        String reservationId,
        Reservation.ReservationStatus status,
        Reservation.PaymentStatus paymentStatus,
        LocalDateTime holdExpiresAt,
        boolean throttled,
        boolean gatewayChecked,
        boolean conflictRecorded
) {
    public static ReservationStatusResponse of(Reservation reservation, boolean throttled, boolean gatewayChecked,
                                               boolean conflictRecorded) {
        return new ReservationStatusResponse(
                reservation.getId(),
                reservation.getStatus(),
                reservation.getPaymentStatus(),
                reservation.getHoldExpiresAt(),
                throttled,
                gatewayChecked,
                conflictRecorded
        );
    }
}
