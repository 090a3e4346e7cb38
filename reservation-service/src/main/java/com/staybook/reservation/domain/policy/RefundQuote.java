package com.staybook.reservation.domain.policy;

/**
 * @param refundPercent     0, 50 or 100 under the default tiers
 * @param refundAmountCents floor of paid amount times percent
 * @param daysBeforeCheckIn whole days between cancellation and check-in
 */
public record RefundQuote(int refundPercent, long refundAmountCents, long daysBeforeCheckIn) {

    public static RefundQuote none(long daysBeforeCheckIn) {
        return new RefundQuote(0, 0L, daysBeforeCheckIn);
    }

    public boolean isRefundable() {
        return refundAmountCents > 0;
    }
}
