package com.staybook.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationExpiredEvent {
    private String reservationId;
    private String guestId;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private int releasedCells;
    private Instant timestamp;
}
