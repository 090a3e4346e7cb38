package com.staybook.reservation.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record CreateReservationRequest(
        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut,

        @NotNull(message = "Guest count cannot be null")
        @Min(value = 1, message = "At least one guest is required")
        @Max(value = 4, message = "At most four guests are allowed")
        Integer guestCount
) {
}
