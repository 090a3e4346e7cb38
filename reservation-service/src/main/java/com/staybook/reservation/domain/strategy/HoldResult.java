package com.staybook.reservation.domain.strategy;

import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of an all-or-nothing hold attempt.
 *
 * @param acquired         true when every requested cell is now held by the caller
 * @param conflictingDates dates that blocked the attempt, empty on success
 */
public record HoldResult(boolean acquired, List<LocalDate> conflictingDates) {

    public static HoldResult ok() {
        return new HoldResult(true, List.of());
    }

    public static HoldResult conflict(List<LocalDate> conflictingDates) {
        return new HoldResult(false, List.copyOf(conflictingDates));
    }
}
