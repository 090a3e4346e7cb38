package com.staybook.reservation.domain.service;

/**
 * What ingesting one payment event did.
 *
 * @param disposition       effect of this delivery
 * @param recordedOutcome   for duplicates, the disposition stored by the first delivery
 * @param reservationStatus reservation status after ingestion
 */
public record ReconciliationResult(
        String eventKey,
        Disposition disposition,
        String recordedOutcome,
        String reservationId,
        String reservationStatus
) {

    public enum Disposition {
        /** The outcome changed attempt and/or reservation state. */
        APPLIED,
        /** Valid event with nothing left to change (already applied, or a failure after success). */
        IGNORED,
        /** The event key was seen before; nothing was done. */
        DUPLICATE
    }
}
