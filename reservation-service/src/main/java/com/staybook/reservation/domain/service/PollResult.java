package com.staybook.reservation.domain.service;

import com.staybook.reservation.domain.model.Reservation;

/**
 * @param reservation state after the poll
 * @param throttled   true when the gateway was not asked because the last pull was too recent
 * @param pulled      true when the gateway was asked for the session status
 */
public record PollResult(Reservation reservation, boolean throttled, boolean pulled) {
}
