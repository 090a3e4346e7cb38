package com.staybook.reservation.exception;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictReason;
import lombok.Getter;

/**
 * A payment outcome that cannot be applied. The conflict id is set once the conflict is persisted.
 */
@Getter
public class ReconciliationConflictException extends BusinessException {
    public static final String CODE = "RECONCILIATION_CONFLICT";

    private final String reservationId;
    private final String paymentAttemptId;
    private final ConflictReason reason;
    private final Long conflictId;

    public ReconciliationConflictException(String reservationId, String paymentAttemptId, ConflictReason reason) {
        this(reservationId, paymentAttemptId, reason, null);
    }

    public ReconciliationConflictException(String reservationId, String paymentAttemptId,
                                           ConflictReason reason, Long conflictId) {
        super(String.format("Payment for attempt %s cannot be applied to reservation %s: %s",
                paymentAttemptId, reservationId, reason), CODE);
        this.reservationId = reservationId;
        this.paymentAttemptId = paymentAttemptId;
        this.reason = reason;
        this.conflictId = conflictId;
    }

    public ReconciliationConflictException withConflictId(Long id) {
        return new ReconciliationConflictException(reservationId, paymentAttemptId, reason, id);
    }
}
