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
public class ReservationCancelledEvent {
    private String reservationId;
    private String guestId;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private String previousStatus;
    private long refundAmountCents;
    private String reason;
    private Instant timestamp;
}
