package com.staybook.reservation.domain.policy;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.domain.model.DateRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FlatRatePricingPolicyTest {

    private FlatRatePricingPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FlatRatePricingPolicy();
        ReflectionTestUtils.setField(policy, "nightlyRateCents", 18_500L);
        ReflectionTestUtils.setField(policy, "cleaningFeeCents", 7_500L);
        ReflectionTestUtils.setField(policy, "minimumNights", 1);
    }

    @Test
    @DisplayName("quote: nights times rate plus one cleaning fee")
    void quote_threeNights() {
        PriceQuote quote = policy.quote(DateRange.ofNights(LocalDate.of(2026, 4, 1), 3));

        assertThat(quote.totalAmountCents()).isEqualTo(3 * 18_500L + 7_500L);
        assertThat(quote.isConsistent()).isTrue();
    }

    @Test
    @DisplayName("quote: stay shorter than the minimum is rejected")
    void quote_belowMinimum_rejected() {
        ReflectionTestUtils.setField(policy, "minimumNights", 2);

        assertThatThrownBy(() -> policy.quote(DateRange.ofNights(LocalDate.of(2026, 4, 1), 1)))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(FlatRatePricingPolicy.MINIMUM_STAY_NOT_MET);
    }

    @Test
    @DisplayName("isConsistent: tampered total is detected")
    void isConsistent_tamperedTotal() {
        assertThat(new PriceQuote(3, 18_500L, 7_500L, 60_000L).isConsistent()).isFalse();
    }
}
