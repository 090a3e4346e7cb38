package com.staybook.reservation.domain.service;

import com.staybook.common.exception.BusinessException;
import com.staybook.common.exception.ResourceNotFoundException;
import com.staybook.reservation.client.PaymentGatewayAdapter;
import com.staybook.reservation.client.dto.CheckoutSessionResponse;
import com.staybook.reservation.client.dto.CreateCheckoutSessionRequest;
import com.staybook.reservation.domain.model.Identifiers;
import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.PaymentAttempt.AttemptStatus;
import com.staybook.reservation.domain.model.PaymentEvent;
import com.staybook.reservation.domain.model.PaymentOutcome;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictReason;
import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.model.Reservation.PaymentStatus;
import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import com.staybook.reservation.domain.repository.PaymentAttemptRepository;
import com.staybook.reservation.domain.service.ReconciliationResult.Disposition;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.ExpiredHoldException;
import com.staybook.reservation.exception.InvalidReservationStateException;
import com.staybook.reservation.exception.MaxAttemptsExceededException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Payment attempts of a reservation and the effect of their outcomes.
 *
 * Attempt status moves are conditional on the current status. {@code succeeded} wins
 * over {@code failed}: a failure reported after a success is ignored, while a success
 * reported after a failure is still applied.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentOrchestrator {

    public static final String CONCURRENT_ATTEMPT = "CONCURRENT_ATTEMPT";

    private static final List<AttemptStatus> OPEN = List.of(AttemptStatus.CREATED, AttemptStatus.PROCESSING);
    private static final List<AttemptStatus> NOT_SUCCEEDED = List.of(
            AttemptStatus.CREATED, AttemptStatus.PROCESSING, AttemptStatus.FAILED, AttemptStatus.EXPIRED);

    private final PaymentAttemptRepository attemptRepository;
    private final ReservationManager reservationManager;
    private final PaymentGatewayAdapter paymentGateway;
    private final Clock clock;

    @Value("${stay.payment.max-attempts:3}")
    private int maxAttempts;

    @Value("${stay.payment.currency:usd}")
    private String currency;

    @Value("${stay.payment.attempt-ttl-minutes:30}")
    private long attemptTtlMinutes;

    /**
     * Opens a new checkout session for a pending reservation. The amount is the
     * reservation total at this moment. Earlier attempts still open are expired first.
     *
     * @throws InvalidReservationStateException when the reservation is not pending
     * @throws ExpiredHoldException             when its hold has elapsed
     * @throws MaxAttemptsExceededException     when all attempts are used up
     */
    @Transactional
    public PaymentAttempt createAttempt(String reservationId) {
        Reservation reservation = reservationManager.getReservation(reservationId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            throw new InvalidReservationStateException(reservationId, reservation.getStatus(), "pay for");
        }
        if (!reservation.isHoldActive(now)) {
            throw new ExpiredHoldException(reservationId);
        }

        int lastAttemptNumber = attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc(reservationId)
                .map(PaymentAttempt::getAttemptNumber)
                .orElse(0);
        if (lastAttemptNumber >= maxAttempts) {
            log.warn("Reservation {} used all {} payment attempts", reservationId, maxAttempts);
            throw new MaxAttemptsExceededException(reservationId, maxAttempts);
        }
        attemptRepository.expireOpenAttempts(reservationId, now);

        PaymentAttempt attempt = PaymentAttempt.builder()
                .id(Identifiers.newPaymentAttemptId())
                .reservationId(reservationId)
                .attemptNumber(lastAttemptNumber + 1)
                .status(AttemptStatus.CREATED)
                .amountCents(reservation.getTotalAmountCents())
                .currency(currency)
                .createdAt(now)
                .updatedAt(now)
                .build();
        try {
            attempt = attemptRepository.saveAndFlush(attempt);
        } catch (DataIntegrityViolationException e) {
            throw new BusinessException(
                    String.format("Another payment attempt for reservation %s was created at the same time", reservationId),
                    e, CONCURRENT_ATTEMPT);
        }

        CheckoutSessionResponse session = paymentGateway.createCheckoutSession(new CreateCheckoutSessionRequest(
                reservationId, attempt.getId(), attempt.getAmountCents(), currency,
                attemptTtlMinutes * 60, attempt.getId()));
        attempt.setExternalSessionId(session.sessionId());
        attempt.setCheckoutUrl(session.checkoutUrl());
        attempt.setAttemptExpiresAt(session.expiresAt() != null
                ? LocalDateTime.ofInstant(Instant.ofEpochSecond(session.expiresAt()), ZoneOffset.UTC)
                : now.plusMinutes(attemptTtlMinutes));
        attempt = attemptRepository.save(attempt);

        if (reservation.getPaymentStatus() != PaymentStatus.PENDING) {
            reservationManager.markPaymentPending(reservationId);
        }
        log.info("Payment attempt {} (#{}/{}) opened for reservation {}: session {}, {} {}",
                attempt.getId(), attempt.getAttemptNumber(), maxAttempts, reservationId,
                session.sessionId(), attempt.getAmountCents(), currency);
        return attempt;
    }

    /**
     * Applies a gateway outcome to an attempt and its reservation. Safe to call more than once
     * for the same outcome; deduplication by event key happens in {@link StatusReconciler}.
     *
     * @throws ReconciliationConflictException when a success arrives for a reservation that can
     *                                         no longer be confirmed; nothing is changed
     * @throws AmountMismatchException         when a success reports no amount or a different one than the attempt
     */
    @Transactional(noRollbackFor = {ReconciliationConflictException.class, AmountMismatchException.class})
    public Disposition applyOutcome(String attemptId, PaymentEvent event) {
        PaymentAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment attempt", attemptId));
        return event.outcome() == PaymentOutcome.SUCCEEDED
                ? applySuccess(attempt, event)
                : applyFailure(attempt);
    }

    private Disposition applySuccess(PaymentAttempt attempt, PaymentEvent event) {
        String reservationId = attempt.getReservationId();
        if (attempt.getStatus() == AttemptStatus.SUCCEEDED) {
            log.debug("Attempt {} already succeeded", attempt.getId());
            return Disposition.IGNORED;
        }
        if (event.amountCents() == null || event.amountCents() != attempt.getAmountCents().longValue()) {
            log.warn("Attempt {} reported {} cents, expected {}", attempt.getId(), event.amountCents(),
                    attempt.getAmountCents());
            throw new AmountMismatchException(attempt.getAmountCents(), event.amountCents());
        }

        Reservation reservation = reservationManager.getReservation(reservationId);
        if (reservation.getStatus() == ReservationStatus.CONFIRMED) {
            // the attempt loaded above may predate the commit that confirmed the reservation
            AttemptStatus current = attemptRepository.findCurrentStatus(attempt.getId()).orElse(attempt.getStatus());
            if (current == AttemptStatus.SUCCEEDED) {
                log.debug("Attempt {} already confirmed reservation {}", attempt.getId(), reservationId);
                return Disposition.IGNORED;
            }
            throw new ReconciliationConflictException(reservationId, attempt.getId(), ConflictReason.DUPLICATE_PAYMENT);
        }
        if (!reservation.isHoldActive(LocalDateTime.now(clock))) {
            throw new ReconciliationConflictException(reservationId, attempt.getId(), ConflictReason.LATE_PAYMENT);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (attemptRepository.transition(attempt.getId(), NOT_SUCCEEDED, AttemptStatus.SUCCEEDED, now) == 0) {
            return Disposition.IGNORED;
        }
        attemptRepository.expireOpenAttempts(reservationId, now);
        reservationManager.confirmFromPayment(reservationId, attempt.getId());
        log.info("Payment attempt {} succeeded for reservation {}", attempt.getId(), reservationId);
        return Disposition.APPLIED;
    }

    private Disposition applyFailure(PaymentAttempt attempt) {
        if (attempt.getStatus() == AttemptStatus.SUCCEEDED) {
            log.info("Ignoring failure for attempt {}: already succeeded", attempt.getId());
            return Disposition.IGNORED;
        }
        if (attemptRepository.transition(attempt.getId(), OPEN, AttemptStatus.FAILED, LocalDateTime.now(clock)) == 0) {
            return Disposition.IGNORED;
        }
        reservationManager.markPaymentFailed(attempt.getReservationId());
        log.info("Payment attempt {} failed for reservation {}", attempt.getId(), attempt.getReservationId());
        return Disposition.APPLIED;
    }

    /**
     * Expires an open attempt whose checkout session has lapsed, freeing the reservation
     * for another attempt.
     */
    @Transactional
    public boolean expireLapsedAttempt(String attemptId) {
        PaymentAttempt attempt = attemptRepository.findById(attemptId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment attempt", attemptId));
        if (attemptRepository.transition(attemptId, OPEN, AttemptStatus.EXPIRED, LocalDateTime.now(clock)) == 0) {
            return false;
        }
        reservationManager.markPaymentFailed(attempt.getReservationId());
        log.info("Payment attempt {} lapsed for reservation {}", attemptId, attempt.getReservationId());
        return true;
    }

    @Transactional(readOnly = true)
    public List<PaymentAttempt> findLapsedAttempts() {
        return attemptRepository.findOpenExpiredBefore(LocalDateTime.now(clock), OPEN);
    }

    @Transactional(readOnly = true)
    public List<PaymentAttempt> getAttempts(String reservationId) {
        return attemptRepository.findByReservationIdOrderByAttemptNumberAsc(reservationId);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
