package com.staybook.reservation.domain.policy;

/**
 * Price of a stay in integer minor units. {@code totalAmountCents} always equals
 * {@code nights * nightlyRateCents + cleaningFeeCents} for quotes built with {@link #of}.
 */
public record PriceQuote(int nights, long nightlyRateCents, long cleaningFeeCents, long totalAmountCents) {

    public static PriceQuote of(int nights, long nightlyRateCents, long cleaningFeeCents) {
        long total = Math.addExact(Math.multiplyExact(nights, nightlyRateCents), cleaningFeeCents);
        return new PriceQuote(nights, nightlyRateCents, cleaningFeeCents, total);
    }

    public boolean isConsistent() {
        return nights > 0
                && nightlyRateCents >= 0
                && cleaningFeeCents >= 0
                && totalAmountCents == (long) nights * nightlyRateCents + cleaningFeeCents;
    }
}
