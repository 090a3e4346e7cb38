package com.staybook.reservation.client.dto;

public record RefundResponse(
        String refundId,
        String status,
        long amountCents
) {
}
