package com.staybook.reservation.domain.policy;

import java.time.LocalDate;

public interface RefundPolicy {

    RefundQuote quote(long paidAmountCents, LocalDate checkIn, LocalDate cancellationDate);
}
