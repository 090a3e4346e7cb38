package com.staybook.reservation.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Published once a payment has turned a pending reservation into a booking.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReservationConfirmedEvent {
    private String reservationId;
    private String guestId;
    private String paymentAttemptId;
    private LocalDate checkIn;
    private LocalDate checkOut;
    private int guestCount;
    private long totalAmountCents;
    private Instant timestamp;
}
