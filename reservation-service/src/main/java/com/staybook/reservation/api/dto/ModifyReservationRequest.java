package com.staybook.reservation.api.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

public record ModifyReservationRequest(
        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkIn,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOut
) {
}
