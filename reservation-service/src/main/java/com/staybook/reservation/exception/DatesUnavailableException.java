package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.domain.model.DateRange;
import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

/**
 * Requested nights are held or booked by someone else. Carries the blocking dates and
 * up to three nearby free ranges of the same length.
 */
@Getter
public class DatesUnavailableException extends BusinessException {
    public static final String CODE = "DATES_UNAVAILABLE";

    private final DateRange requested;
    private final List<LocalDate> conflictingDates;
    private final List<DateRange> alternatives;

    public DatesUnavailableException(DateRange requested, List<LocalDate> conflictingDates,
                                     List<DateRange> alternatives) {
        super(String.format("Dates %s are not available: %s", requested, conflictingDates), CODE);
        this.requested = requested;
        this.conflictingDates = List.copyOf(conflictingDates);
        this.alternatives = List.copyOf(alternatives);
    }
}
