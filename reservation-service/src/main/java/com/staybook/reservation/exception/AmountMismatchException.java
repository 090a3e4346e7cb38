package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import lombok.Getter;

/**
 * Raised either when a price quote does not add up on create, or when the gateway reports
 * an amount different from the attempt snapshot. A success reported without any amount
 * counts as a mismatch with a null actual amount.
 */
@Getter
public class AmountMismatchException extends BusinessException {
    public static final String CODE = "AMOUNT_MISMATCH";

    private final long expectedAmountCents;
    private final Long actualAmountCents;

    public AmountMismatchException(long expectedAmountCents, Long actualAmountCents) {
        super(String.format("Amount mismatch: expected %d cents but got %d cents",
                expectedAmountCents, actualAmountCents), CODE);
        this.expectedAmountCents = expectedAmountCents;
        this.actualAmountCents = actualAmountCents;
    }
}
