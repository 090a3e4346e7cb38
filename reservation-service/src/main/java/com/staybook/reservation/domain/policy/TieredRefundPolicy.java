package com.staybook.reservation.domain.policy;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Refund by notice period: full refund at {@code full-refund-days} or more before check-in,
 * half refund at {@code partial-refund-days} or more, nothing after that. Amounts round down.
 */
@Component
public class TieredRefundPolicy implements RefundPolicy {

    @Value("${stay.refund.full-refund-days:14}")
    private int fullRefundDays;

    @Value("${stay.refund.partial-refund-days:7}")
    private int partialRefundDays;

    @Value("${stay.refund.partial-refund-percent:50}")
    private int partialRefundPercent;

    @Override
    public RefundQuote quote(long paidAmountCents, LocalDate checkIn, LocalDate cancellationDate) {
        long daysBefore = ChronoUnit.DAYS.between(cancellationDate, checkIn);
        int percent;
        if (daysBefore >= fullRefundDays) {
            percent = 100;
        } else if (daysBefore >= partialRefundDays) {
            percent = partialRefundPercent;
        } else {
            return RefundQuote.none(daysBefore);
        }
        long amount = Math.multiplyExact(paidAmountCents, percent) / 100;
        return new RefundQuote(percent, amount, daysBefore);
    }
}
