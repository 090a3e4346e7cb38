package com.staybook.reservation.domain.model;

import com.staybook.common.exception.BusinessException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Stay interval with exclusive check-out: [checkIn, checkOut).
 */
public record DateRange(LocalDate checkIn, LocalDate checkOut) {

    public static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";

    public DateRange {
        if (checkIn == null || checkOut == null) {
            throw new BusinessException("Check-in and check-out dates are required", INVALID_DATE_RANGE);
        }
        if (!checkIn.isBefore(checkOut)) {
            throw new BusinessException(
                    String.format("Check-in %s must be before check-out %s", checkIn, checkOut),
                    INVALID_DATE_RANGE);
        }
    }

    public static DateRange of(LocalDate checkIn, LocalDate checkOut) {
        return new DateRange(checkIn, checkOut);
    }

    public static DateRange ofNights(LocalDate checkIn, int nights) {
        return new DateRange(checkIn, checkIn.plusDays(nights));
    }

    public int nights() {
        return (int) ChronoUnit.DAYS.between(checkIn, checkOut);
    }

    /**
     * Every occupied night, in order. The check-out date itself is not included.
     */
    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(nights());
        LocalDate current = checkIn;
        while (current.isBefore(checkOut)) {
            dates.add(current);
            current = current.plusDays(1);
        }
        return dates;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(checkIn) && date.isBefore(checkOut);
    }

    public boolean overlaps(DateRange other) {
        return checkIn.isBefore(other.checkOut) && other.checkIn.isBefore(checkOut);
    }

    /**
     * Nights of this range that the other range does not cover.
     */
    public List<LocalDate> datesNotIn(DateRange other) {
        Objects.requireNonNull(other, "other");
        return dates().stream().filter(d -> !other.contains(d)).toList();
    }

    @Override
    public String toString() {
        return "[" + checkIn + ", " + checkOut + ")";
    }
}
