package com.staybook.reservation.client.dto;

/**
 * @param expiresAt epoch seconds after which the gateway refuses the session
 */
public record CheckoutSessionResponse(
        String sessionId,
        String checkoutUrl,
        Long expiresAt
) {
}
