package com.staybook.reservation.domain.strategy;

import java.time.LocalDate;
import java.util.List;

/**
 * Rolls back a transactional hold attempt. Never leaves the ledger: AvailabilityLedger
 * turns it into a {@link HoldResult#conflict(List)}.
 */
public class HoldConflictException extends RuntimeException {

    private final List<LocalDate> conflictingDates;

    public HoldConflictException(List<LocalDate> conflictingDates) {
        super("Ledger cells unavailable: " + conflictingDates);
        this.conflictingDates = List.copyOf(conflictingDates);
    }

    public List<LocalDate> getConflictingDates() {
        return conflictingDates;
    }
}
