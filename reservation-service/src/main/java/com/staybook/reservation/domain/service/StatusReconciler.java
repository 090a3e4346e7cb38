package com.staybook.reservation.domain.service;

import com.staybook.common.exception.ResourceNotFoundException;
import com.staybook.common.util.Constants;
import com.staybook.reservation.client.PaymentGatewayAdapter;
import com.staybook.reservation.client.dto.SessionStatusResponse;
import com.staybook.reservation.domain.model.IdempotencyRecord;
import com.staybook.reservation.domain.model.IdempotencyRecord.RecordType;
import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.PaymentEvent;
import com.staybook.reservation.domain.model.PaymentOutcome;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictReason;
import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import com.staybook.reservation.domain.repository.PaymentAttemptRepository;
import com.staybook.reservation.domain.repository.ReservationRepository;
import com.staybook.reservation.domain.service.ReconciliationResult.Disposition;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;

/**
 * Single entry point for payment outcomes, whichever channel reports them.
 *
 * Webhooks call {@link #ingest} directly. Status polls pull the latest session status from
 * the gateway and, when it is terminal, feed it through the same {@link #ingest} under the
 * key {@code poll:<session>:<outcome>}. Either way the event key is claimed in the
 * idempotency table in the same transaction as the state change, so each distinct event
 * has its effect once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusReconciler {

    static final String EVENT_KEY_PREFIX = "event:";
    static final String CONFLICT_OUTCOME = "CONFLICT";

    private final IdempotencyGuard idempotencyGuard;
    private final PaymentAttemptRepository attemptRepository;
    private final ReservationRepository reservationRepository;
    private final PaymentOrchestrator paymentOrchestrator;
    private final ReconciliationConflictService conflictService;
    private final PaymentGatewayAdapter paymentGateway;
    private final PollThrottle pollThrottle;

    public enum Channel {
        WEBHOOK,
        POLL
    }

    /**
     * @throws ReconciliationConflictException after the conflict has been stored, when a success
     *                                         cannot be applied
     * @throws AmountMismatchException         after the conflict has been stored, when the amount differs
     */
    @Transactional(noRollbackFor = {ReconciliationConflictException.class, AmountMismatchException.class})
    public ReconciliationResult ingest(PaymentEvent event, Channel channel) {
        PaymentAttempt attempt = attemptRepository.findByExternalSessionId(event.externalSessionId())
                .orElseThrow(() -> new ResourceNotFoundException("Checkout session", event.externalSessionId()));
        String reservationId = attempt.getReservationId();
        String key = EVENT_KEY_PREFIX + event.eventKey();

        if (!idempotencyGuard.recordIfNew(key, RecordType.EVENT, reservationId)) {
            IdempotencyRecord prior = idempotencyGuard.find(key)
                    .orElseThrow(() -> new IllegalStateException("Claimed idempotency key vanished: " + key));
            log.info("Duplicate payment event {} via {} ignored (first outcome {})",
                    event.eventKey(), channel, prior.getOutcome());
            return new ReconciliationResult(event.eventKey(), Disposition.DUPLICATE, prior.getOutcome(),
                    reservationId, currentStatus(reservationId));
        }

        try {
            Disposition disposition = paymentOrchestrator.applyOutcome(attempt.getId(), event);
            String status = currentStatus(reservationId);
            idempotencyGuard.complete(key, reservationId, disposition.name(), status, null);
            log.info("Payment event {} via {}: {} {} -> reservation {} {}",
                    event.eventKey(), channel, event.outcome(), disposition, reservationId, status);
            return new ReconciliationResult(event.eventKey(), disposition, disposition.name(), reservationId, status);
        } catch (ReconciliationConflictException e) {
            ReconciliationConflictRecord conflict = recordConflict(key, event, attempt, e.getReason(), channel);
            throw e.withConflictId(conflict.getId());
        } catch (AmountMismatchException e) {
            recordConflict(key, event, attempt, ConflictReason.AMOUNT_MISMATCH, channel);
            throw e;
        }
    }

    /**
     * Pull channel. Asks the gateway about the latest attempt of a pending reservation at most
     * once per throttle interval; otherwise returns the stored state.
     */
    @Transactional(noRollbackFor = {ReconciliationConflictException.class, AmountMismatchException.class})
    public PollResult poll(String reservationId) {
        Reservation reservation = reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            return new PollResult(reservation, false, false);
        }
        Optional<PaymentAttempt> latest = attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc(reservationId)
                .filter(attempt -> attempt.getExternalSessionId() != null);
        if (latest.isEmpty()) {
            return new PollResult(reservation, false, false);
        }
        if (!pollThrottle.tryAcquire(reservationId)) {
            return new PollResult(reservation, true, false);
        }

        String sessionId = latest.get().getExternalSessionId();
        SessionStatusResponse status = paymentGateway.getSessionStatus(sessionId);
        Optional<PaymentOutcome> outcome = status.terminalOutcome();
        if (outcome.isPresent()) {
            String eventKey = Constants.POLL_EVENT_KEY_PREFIX + sessionId + ":"
                    + outcome.get().name().toLowerCase(Locale.ROOT);
            ingest(new PaymentEvent(eventKey, sessionId, outcome.get(), status.amountTotal()), Channel.POLL);
        } else {
            log.debug("Session {} of reservation {} still {}", sessionId, reservationId, status.status());
        }
        return new PollResult(reservationRepository.findById(reservationId).orElse(reservation), false, true);
    }

    private ReconciliationConflictRecord recordConflict(String key, PaymentEvent event, PaymentAttempt attempt,
                                                        ConflictReason reason, Channel channel) {
        String status = currentStatus(attempt.getReservationId());
        ReconciliationConflictRecord conflict = conflictService.record(event, attempt, reason, channel, status);
        idempotencyGuard.complete(key, attempt.getReservationId(), CONFLICT_OUTCOME, status, null);
        return conflict;
    }

    private String currentStatus(String reservationId) {
        return reservationRepository.findById(reservationId)
                .map(reservation -> reservation.getStatus().name())
                .orElse(null);
    }
}
