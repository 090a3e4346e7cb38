package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import lombok.Getter;

@Getter
public class InvalidReservationStateException extends BusinessException {
    public static final String CODE = "INVALID_RESERVATION_STATE";

    private final String reservationId;
    private final ReservationStatus currentStatus;

    public InvalidReservationStateException(String reservationId, ReservationStatus currentStatus, String action) {
        super(String.format("Cannot %s reservation %s in status %s", action, reservationId, currentStatus), CODE);
        this.reservationId = reservationId;
        this.currentStatus = currentStatus;
    }
}
