package com.staybook.reservation.domain.service;

import com.staybook.common.exception.BusinessException;
import com.staybook.common.exception.ResourceNotFoundException;
import com.staybook.reservation.client.PaymentGatewayAdapter;
import com.staybook.reservation.client.dto.CreateRefundRequest;
import com.staybook.reservation.domain.model.DateRange;
import com.staybook.reservation.domain.model.Identifiers;
import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.PaymentAttempt.AttemptStatus;
import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.model.Reservation.PaymentStatus;
import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import com.staybook.reservation.domain.policy.PriceQuote;
import com.staybook.reservation.domain.policy.RefundPolicy;
import com.staybook.reservation.domain.policy.RefundQuote;
import com.staybook.reservation.domain.repository.PaymentAttemptRepository;
import com.staybook.reservation.domain.repository.ReservationRepository;
import com.staybook.reservation.domain.strategy.HoldResult;
import com.staybook.reservation.events.ReservationEventPublisher;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.DatesUnavailableException;
import com.staybook.reservation.exception.ExpiredHoldException;
import com.staybook.reservation.exception.InvalidReservationStateException;
import com.staybook.reservation.exception.LedgerHolderMismatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Reservation state machine.
 *
 *   pending → confirmed → completed
 *   pending → expired
 *   pending → cancelled
 *   confirmed → cancelled
 *
 * Ledger cells are only touched through {@link AvailabilityLedger}. Every status move is a
 * conditional UPDATE on the current status, so concurrent movers (a payment confirmation
 * and the reaper, two cancels) cannot both win.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationManager {

    public static final String INVALID_GUEST_COUNT = "INVALID_GUEST_COUNT";
    public static final String CHECK_IN_IN_PAST = "CHECK_IN_IN_PAST";
    public static final String PAYMENT_IN_PROGRESS = "PAYMENT_IN_PROGRESS";

    private final ReservationRepository reservationRepository;
    private final PaymentAttemptRepository paymentAttemptRepository;
    private final AvailabilityLedger ledger;
    private final RefundPolicy refundPolicy;
    private final PaymentGatewayAdapter paymentGateway;
    private final ReservationEventPublisher eventPublisher;
    private final Clock clock;

    @Value("${stay.reservation.hold-duration-minutes:30}")
    private long holdDurationMinutes;

    @Value("${stay.reservation.min-guests:1}")
    private int minGuests;

    @Value("${stay.reservation.max-guests:4}")
    private int maxGuests;

    @Value("${stay.ledger.alternatives.max-results:3}")
    private int maxAlternatives;

    /**
     * Holds the range and records a pending reservation with the price snapshot.
     *
     * @throws DatesUnavailableException when any night is taken; nothing is held in that case
     * @throws AmountMismatchException   when the quote does not add up for the range
     */
    @Transactional
    public Reservation create(String guestId, DateRange range, int guestCount, PriceQuote quote) {
        LocalDateTime now = LocalDateTime.now(clock);
        validateGuestCount(guestCount);
        validateNotInPast(range, now.toLocalDate());
        if (quote.nights() != range.nights() || !quote.isConsistent()) {
            long expected = (long) range.nights() * quote.nightlyRateCents() + quote.cleaningFeeCents();
            throw new AmountMismatchException(expected, quote.totalAmountCents());
        }

        String reservationId = Identifiers.newReservationId();
        LocalDateTime holdExpiresAt = now.plusMinutes(holdDurationMinutes);
        HoldResult hold = ledger.acquireHold(range, reservationId, holdExpiresAt);
        if (!hold.acquired()) {
            throw new DatesUnavailableException(range, hold.conflictingDates(),
                    ledger.suggestAlternatives(range, maxAlternatives));
        }

        Reservation reservation = Reservation.builder()
                .id(reservationId)
                .guestId(guestId)
                .checkIn(range.checkIn())
                .checkOut(range.checkOut())
                .guestCount(guestCount)
                .nights(quote.nights())
                .nightlyRateCents(quote.nightlyRateCents())
                .cleaningFeeCents(quote.cleaningFeeCents())
                .totalAmountCents(quote.totalAmountCents())
                .status(ReservationStatus.PENDING)
                .paymentStatus(PaymentStatus.NONE)
                .holdExpiresAt(holdExpiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
        reservation = reservationRepository.save(reservation);
        log.info("Reservation {} created for guest {}: {} ({} nights, {} cents), hold until {}",
                reservationId, guestId, range, quote.nights(), quote.totalAmountCents(), holdExpiresAt);
        return reservation;
    }

    /**
     * pending → confirmed after a successful payment. A reservation that is already
     * confirmed is returned unchanged.
     *
     * @throws ExpiredHoldException when the hold elapsed before the payment was applied
     */
    @Transactional
    public Reservation confirmFromPayment(String reservationId, String paymentAttemptId) {
        Reservation reservation = getReservation(reservationId);
        if (reservation.getStatus() == ReservationStatus.CONFIRMED) {
            return reservation;
        }
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            throw new InvalidReservationStateException(reservationId, reservation.getStatus(), "confirm");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        if (!reservation.isHoldActive(now)) {
            throw new ExpiredHoldException(reservationId);
        }

        DateRange range = reservation.dateRange();
        if (!ledger.confirm(range, reservationId)) {
            throw new LedgerHolderMismatchException(reservationId, range);
        }
        if (reservationRepository.confirmIfHoldActive(reservationId, now) == 0) {
            throw new ExpiredHoldException(reservationId);
        }

        Reservation confirmed = getReservation(reservationId);
        log.info("Reservation {} confirmed by payment attempt {}", reservationId, paymentAttemptId);
        eventPublisher.publishReservationConfirmed(confirmed, paymentAttemptId);
        return confirmed;
    }

    /**
     * Moves a pending reservation to new dates, keeping its hold deadline and price snapshot.
     *
     * Nights only in the new range are taken under a temporary holder first. If any of them
     * is unavailable the reservation keeps its original nights and a
     * {@link DatesUnavailableException} is raised. Otherwise the nights only in the old range
     * are released and the new ones handed over to the reservation.
     */
    @Transactional
    public Reservation modify(String reservationId, DateRange newRange) {
        Reservation reservation = getReservation(reservationId);
        LocalDateTime now = LocalDateTime.now(clock);
        if (reservation.getStatus() != ReservationStatus.PENDING) {
            throw new InvalidReservationStateException(reservationId, reservation.getStatus(), "modify");
        }
        if (!reservation.isHoldActive(now)) {
            throw new ExpiredHoldException(reservationId);
        }
        if (reservation.getPaymentStatus() == PaymentStatus.PENDING) {
            throw new BusinessException(
                    String.format("Reservation %s has a payment in progress and cannot change dates", reservationId),
                    PAYMENT_IN_PROGRESS);
        }
        validateNotInPast(newRange, now.toLocalDate());

        DateRange oldRange = reservation.dateRange();
        if (oldRange.equals(newRange)) {
            return reservation;
        }

        List<LocalDate> toAcquire = newRange.datesNotIn(oldRange);
        List<LocalDate> toRelease = oldRange.datesNotIn(newRange);
        String marker = reservationId + "#move-" + Identifiers.randomHex(8);

        HoldResult hold = ledger.acquireDates(toAcquire, marker, reservation.getHoldExpiresAt());
        if (!hold.acquired()) {
            throw new DatesUnavailableException(newRange, hold.conflictingDates(),
                    ledger.suggestAlternatives(newRange, maxAlternatives));
        }
        ledger.releaseDates(toRelease, reservationId);
        ledger.repoint(toAcquire, marker, reservationId);

        PriceQuote repriced = PriceQuote.of(newRange.nights(),
                reservation.getNightlyRateCents(), reservation.getCleaningFeeCents());
        reservation.setCheckIn(newRange.checkIn());
        reservation.setCheckOut(newRange.checkOut());
        reservation.setNights(repriced.nights());
        reservation.setTotalAmountCents(repriced.totalAmountCents());
        reservation.setUpdatedAt(now);
        Reservation saved = reservationRepository.save(reservation);
        log.info("Reservation {} moved from {} to {} (+{} / -{} nights), total {} cents",
                reservationId, oldRange, newRange, toAcquire.size(), toRelease.size(), repriced.totalAmountCents());
        return saved;
    }

    /**
     * Cancels a pending or confirmed reservation and frees its nights. A confirmed reservation
     * is refunded according to {@link RefundPolicy}; the gateway refund is requested last, so
     * a gateway failure rolls the whole cancellation back. Cancelling twice is a no-op.
     */
    @Transactional
    public CancellationResult cancel(String reservationId, String reason) {
        Reservation reservation = getReservation(reservationId);
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        long daysBefore = ChronoUnit.DAYS.between(today, reservation.getCheckIn());
        ReservationStatus previous = reservation.getStatus();

        if (previous == ReservationStatus.CANCELLED) {
            long refunded = reservation.getRefundAmountCents() == null ? 0L : reservation.getRefundAmountCents();
            return new CancellationResult(reservation, new RefundQuote(0, refunded, daysBefore));
        }
        if (previous != ReservationStatus.PENDING && previous != ReservationStatus.CONFIRMED) {
            throw new InvalidReservationStateException(reservationId, previous, "cancel");
        }

        RefundQuote refund = RefundQuote.none(daysBefore);
        PaymentStatus paymentStatus = reservation.getPaymentStatus();
        if (previous == ReservationStatus.CONFIRMED) {
            refund = refundPolicy.quote(reservation.getTotalAmountCents(), reservation.getCheckIn(), today);
            if (refund.isRefundable()) {
                paymentStatus = PaymentStatus.REFUNDED;
            }
        } else {
            paymentAttemptRepository.expireOpenAttempts(reservationId, now);
        }

        int updated = reservationRepository.cancelIfStatus(reservationId, previous, ReservationStatus.CANCELLED,
                paymentStatus, refund.refundAmountCents(), reason, now);
        if (updated == 0) {
            throw new InvalidReservationStateException(reservationId, currentStatus(reservationId), "cancel");
        }
        int released = ledger.release(reservation.dateRange(), reservationId);

        if (refund.isRefundable()) {
            PaymentAttempt paid = findSucceededAttempt(reservationId);
            paymentGateway.createRefund(new CreateRefundRequest(paid.getExternalSessionId(), reservationId,
                    refund.refundAmountCents(), "refund-" + reservationId));
        }

        log.info("Reservation {} cancelled from {} ({} cells released, refund {} cents at {}%)",
                reservationId, previous, released, refund.refundAmountCents(), refund.refundPercent());
        Reservation cancelled = getReservation(reservationId);
        eventPublisher.publishReservationCancelled(cancelled, previous, refund.refundAmountCents(), reason);
        return new CancellationResult(cancelled, refund);
    }

    /**
     * pending → expired once the hold has elapsed, then frees the nights and closes open
     * payment attempts. The status move runs first so a late confirmation can no longer win;
     * the remaining steps are idempotent.
     *
     * @return false when the reservation was not eligible (already confirmed, cancelled or expired)
     */
    @Transactional
    public boolean expireHold(String reservationId) {
        LocalDateTime now = LocalDateTime.now(clock);
        if (reservationRepository.expireIfHoldElapsed(reservationId, now) == 0) {
            return false;
        }
        Reservation reservation = getReservation(reservationId);
        int released = ledger.release(reservation.dateRange(), reservationId);
        int expiredAttempts = paymentAttemptRepository.expireOpenAttempts(reservationId, now);
        log.info("Reservation {} expired: {} cells released, {} open attempts expired",
                reservationId, released, expiredAttempts);
        eventPublisher.publishReservationExpired(reservation, released);
        return true;
    }

    /**
     * confirmed → completed once check-out has passed.
     */
    @Transactional
    public boolean completeStay(String reservationId) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = reservationRepository.completeIfCheckedOut(reservationId, now.toLocalDate(), now,
                ReservationStatus.CONFIRMED, ReservationStatus.COMPLETED);
        if (updated == 1) {
            log.info("Reservation {} completed", reservationId);
        }
        return updated == 1;
    }

    /**
     * Payment status none|failed → pending when a new attempt is opened.
     */
    @Transactional
    public void markPaymentPending(String reservationId) {
        int updated = reservationRepository.movePaymentStatus(reservationId,
                List.of(PaymentStatus.NONE, PaymentStatus.FAILED), PaymentStatus.PENDING,
                LocalDateTime.now(clock), ReservationStatus.PENDING);
        if (updated == 0) {
            throw new InvalidReservationStateException(reservationId, currentStatus(reservationId), "start payment for");
        }
    }

    /**
     * Payment status pending → failed. No-op when the payment is no longer pending.
     */
    @Transactional
    public boolean markPaymentFailed(String reservationId) {
        int updated = reservationRepository.movePaymentStatus(reservationId,
                List.of(PaymentStatus.PENDING), PaymentStatus.FAILED,
                LocalDateTime.now(clock), ReservationStatus.PENDING);
        if (updated == 1) {
            log.info("Payment for reservation {} marked failed", reservationId);
        }
        return updated == 1;
    }

    @Transactional(readOnly = true)
    public Reservation getReservation(String reservationId) {
        return reservationRepository.findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }

    private ReservationStatus currentStatus(String reservationId) {
        return getReservation(reservationId).getStatus();
    }

    private PaymentAttempt findSucceededAttempt(String reservationId) {
        return paymentAttemptRepository.findByReservationIdOrderByAttemptNumberAsc(reservationId).stream()
                .filter(attempt -> attempt.getStatus() == AttemptStatus.SUCCEEDED)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException(
                        "Confirmed reservation " + reservationId + " has no succeeded payment attempt"));
    }

    private void validateGuestCount(int guestCount) {
        if (guestCount < minGuests || guestCount > maxGuests) {
            throw new BusinessException(
                    String.format("Guest count must be between %d and %d, got %d", minGuests, maxGuests, guestCount),
                    INVALID_GUEST_COUNT);
        }
    }

    private void validateNotInPast(DateRange range, LocalDate today) {
        if (range.checkIn().isBefore(today)) {
            throw new BusinessException(
                    String.format("Check-in %s is in the past", range.checkIn()), CHECK_IN_IN_PAST);
        }
    }
}
