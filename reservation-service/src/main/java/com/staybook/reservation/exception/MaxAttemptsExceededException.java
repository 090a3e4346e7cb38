package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import lombok.Getter;

@Getter
public class MaxAttemptsExceededException extends BusinessException {
    public static final String CODE = "MAX_ATTEMPTS_EXCEEDED";

    private final String reservationId;
    private final int maxAttempts;

    public MaxAttemptsExceededException(String reservationId, int maxAttempts) {
        super(String.format("Maximum %d payment attempts exceeded. Please contact support.", maxAttempts), CODE);
        this.reservationId = reservationId;
        this.maxAttempts = maxAttempts;
    }
}
