package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;

public class ReservationAccessDeniedException extends BusinessException {
    public static final String CODE = "ACCESS_DENIED";

    public ReservationAccessDeniedException(String reservationId) {
        super(String.format("Reservation %s does not belong to the requesting guest", reservationId), CODE);
    }
}
