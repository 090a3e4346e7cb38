package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import lombok.Getter;

@Getter
public class ExpiredHoldException extends BusinessException {
    public static final String CODE = "HOLD_EXPIRED";

    private final String reservationId;

    public ExpiredHoldException(String reservationId) {
        super(String.format("Hold for reservation %s has expired. Please start a new reservation.", reservationId), CODE);
        this.reservationId = reservationId;
    }
}
