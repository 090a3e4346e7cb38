package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.domain.model.DateRange;

/**
 * The ledger cells of a range are no longer held by the reservation trying to confirm them.
 */
public class LedgerHolderMismatchException extends BusinessException {
    public static final String CODE = "LEDGER_NOT_HOLDER";

    public LedgerHolderMismatchException(String holderId, DateRange range) {
        super(String.format("Reservation %s no longer holds every night of %s", holderId, range), CODE);
    }
}
