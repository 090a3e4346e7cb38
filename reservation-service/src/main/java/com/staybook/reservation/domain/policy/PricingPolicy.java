package com.staybook.reservation.domain.policy;

import com.staybook.reservation.domain.model.DateRange;

/**
 * Pure price computation for a stay. The engine snapshots the result on the reservation
 * and never re-reads it afterwards.
 */
public interface PricingPolicy {

    PriceQuote quote(DateRange range);
}
