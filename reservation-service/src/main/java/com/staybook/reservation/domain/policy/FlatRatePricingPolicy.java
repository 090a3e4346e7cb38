package com.staybook.reservation.domain.policy;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.domain.model.DateRange;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Configured nightly rate times nights, plus a one-off cleaning fee.
 */
@Component
public class FlatRatePricingPolicy implements PricingPolicy {

    public static final String MINIMUM_STAY_NOT_MET = "MINIMUM_STAY_NOT_MET";

    @Value("${stay.pricing.nightly-rate-cents:18500}")
    private long nightlyRateCents;

    @Value("${stay.pricing.cleaning-fee-cents:7500}")
    private long cleaningFeeCents;

    @Value("${stay.pricing.minimum-nights:1}")
    private int minimumNights;

    @Override
    public PriceQuote quote(DateRange range) {
        int nights = range.nights();
        if (nights < minimumNights) {
            throw new BusinessException(
                    String.format("Minimum stay is %d nights, requested %d", minimumNights, nights),
                    MINIMUM_STAY_NOT_MET);
        }
        return PriceQuote.of(nights, nightlyRateCents, cleaningFeeCents);
    }
}
