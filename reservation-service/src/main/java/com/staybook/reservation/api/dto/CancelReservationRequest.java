package com.staybook.reservation.api.dto;

import jakarta.validation.constraints.Size;

public record CancelReservationRequest(
        @Size(max = 500, message = "Reason must be at most 500 characters")
        String reason
) {
}
