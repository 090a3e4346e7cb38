package com.staybook.reservation.api.dto;

import com.staybook.reservation.domain.service.CancellationResult;

public record CancellationResponse(
        ReservationResponse reservation,
        int refundPercent,
        long refundAmountCents,
        long daysBeforeCheckIn
) {
    public static CancellationResponse from(CancellationResult result) {
        return new CancellationResponse(
                ReservationResponse.from(result.reservation()),
                result.refund().refundPercent(),
                result.refund().refundAmountCents(),
                result.refund().daysBeforeCheckIn()
        );
    }
}
