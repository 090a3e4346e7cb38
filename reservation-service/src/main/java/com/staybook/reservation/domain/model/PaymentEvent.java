package com.staybook.reservation.domain.model;

/**
 * Payment outcome reported by the gateway, either pushed by webhook or obtained by a status pull.
 *
 * @param eventKey          stable key used for deduplication
 * @param externalSessionId checkout session the outcome belongs to
 * @param outcome           succeeded or failed
 * @param amountCents       amount the gateway reports, may be null when the channel does not carry it
 */
public record PaymentEvent(
        String eventKey,
        String externalSessionId,
        PaymentOutcome outcome,
        Long amountCents
) {
}
