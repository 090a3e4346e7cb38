package com.staybook.reservation.domain.service;

import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.policy.RefundQuote;

public record CancellationResult(Reservation reservation, RefundQuote refund) {
}
