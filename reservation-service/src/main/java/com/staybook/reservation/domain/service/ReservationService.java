package com.staybook.reservation.domain.service;

import com.staybook.common.exception.BusinessException;
import com.staybook.common.util.Constants;
import com.staybook.reservation.api.dto.CancellationResponse;
import com.staybook.reservation.api.dto.CreateReservationRequest;
import com.staybook.reservation.api.dto.ModifyReservationRequest;
import com.staybook.reservation.api.dto.PaymentAttemptResponse;
import com.staybook.reservation.api.dto.PaymentHistoryResponse;
import com.staybook.reservation.api.dto.ReservationResponse;
import com.staybook.reservation.api.dto.ReservationStatusResponse;
import com.staybook.reservation.domain.model.DateRange;
import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.policy.PriceQuote;
import com.staybook.reservation.domain.policy.PricingPolicy;
import com.staybook.reservation.domain.repository.ReservationRepository;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import com.staybook.reservation.exception.ReservationAccessDeniedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Guest-facing commands. Checks ownership, applies the optional idempotency key and
 * delegates to the reservation and payment components.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final String DEFAULT_CANCELLATION_REASON = "Cancelled by guest";
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 64;
    static final int MAX_GUEST_ID_LENGTH = 128;

    private final ReservationManager reservationManager;
    private final PaymentOrchestrator paymentOrchestrator;
    private final StatusReconciler statusReconciler;
    private final PricingPolicy pricingPolicy;
    private final IdempotencyGuard idempotencyGuard;
    private final ReservationRepository reservationRepository;

    @Transactional
    public ReservationResponse createReservation(String guestId, CreateReservationRequest request,
                                                 String idempotencyKey) {
        return once("create", guestId, idempotencyKey, ReservationResponse.class, () -> {
            DateRange range = DateRange.of(request.checkIn(), request.checkOut());
            PriceQuote quote = pricingPolicy.quote(range);
            log.info("Creating reservation for guest {}: {} with {} guest(s)", guestId, range, request.guestCount());
            Reservation reservation = reservationManager.create(guestId, range, request.guestCount(), quote);
            return ReservationResponse.from(reservation);
        }, ReservationResponse::id, response -> response.status().name());
    }

    @Transactional(readOnly = true)
    public ReservationResponse getReservation(String reservationId, String guestId) {
        return ReservationResponse.from(loadOwned(reservationId, guestId));
    }

    @Transactional(readOnly = true)
    public List<ReservationResponse> getReservationsForGuest(String guestId) {
        return reservationRepository.findByGuestIdOrderByCreatedAtDesc(guestId).stream()
                .map(ReservationResponse::from)
                .toList();
    }

    @Transactional
    public ReservationResponse modifyReservation(String reservationId, String guestId,
                                                 ModifyReservationRequest request, String idempotencyKey) {
        return once("modify", guestId, idempotencyKey, ReservationResponse.class, () -> {
            loadOwned(reservationId, guestId);
            DateRange newRange = DateRange.of(request.checkIn(), request.checkOut());
            return ReservationResponse.from(reservationManager.modify(reservationId, newRange));
        }, ReservationResponse::id, response -> response.status().name());
    }

    @Transactional
    public CancellationResponse cancelReservation(String reservationId, String guestId, String reason,
                                                  String idempotencyKey) {
        return once("cancel", guestId, idempotencyKey, CancellationResponse.class, () -> {
            loadOwned(reservationId, guestId);
            String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_CANCELLATION_REASON : reason;
            return CancellationResponse.from(reservationManager.cancel(reservationId, effectiveReason));
        }, response -> response.reservation().id(), response -> response.reservation().status().name());
    }

    @Transactional
    public PaymentAttemptResponse createPaymentAttempt(String reservationId, String guestId, String idempotencyKey) {
        return once("payment-attempt", guestId, idempotencyKey, PaymentAttemptResponse.class, () -> {
            loadOwned(reservationId, guestId);
            return PaymentAttemptResponse.from(paymentOrchestrator.createAttempt(reservationId));
        }, PaymentAttemptResponse::reservationId, response -> response.status().name());
    }

    /**
     * Status poll. Not transactional itself: the reconciler commits whatever the gateway
     * reported, including a conflict, before this method reads the result back.
     */
    public ReservationStatusResponse getReservationStatus(String reservationId, String guestId) {
        loadOwned(reservationId, guestId);
        try {
            PollResult result = statusReconciler.poll(reservationId);
            return ReservationStatusResponse.of(result.reservation(), result.throttled(), result.pulled(), false);
        } catch (ReconciliationConflictException | AmountMismatchException e) {
            log.warn("Status poll for {} surfaced a payment conflict: {}", reservationId, e.getMessage());
            return ReservationStatusResponse.of(reservationManager.getReservation(reservationId), false, true, true);
        }
    }

    @Transactional(readOnly = true)
    public PaymentHistoryResponse getPaymentHistory(String reservationId, String guestId) {
        Reservation reservation = loadOwned(reservationId, guestId);
        return PaymentHistoryResponse.of(reservation, paymentOrchestrator.getAttempts(reservationId),
                paymentOrchestrator.getMaxAttempts());
    }

    private Reservation loadOwned(String reservationId, String guestId) {
        Reservation reservation = reservationManager.getReservation(reservationId);
        if (!reservation.isOwnedBy(guestId)) {
            log.warn("Guest {} denied access to reservation {}", guestId, reservationId);
            throw new ReservationAccessDeniedException(reservationId);
        }
        return reservation;
    }

    private static void requireMaxLength(String header, String value, int maxLength) {
        if (value.length() > maxLength) {
            throw new BusinessException(String.format("%s must be at most %d characters", header, maxLength),
                    "VALIDATION_ERROR");
        }
    }

    private <T> T once(String command, String guestId, String idempotencyKey, Class<T> responseType,
                       Supplier<T> action, Function<T, String> reservationIdOf, Function<T, String> statusOf) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return action.get();
        }
        // composed key must fit idempotency_records.idempotency_key (255)
        requireMaxLength(Constants.HEADER_IDEMPOTENCY_KEY, idempotencyKey, MAX_IDEMPOTENCY_KEY_LENGTH);
        requireMaxLength(Constants.HEADER_GUEST_ID, guestId, MAX_GUEST_ID_LENGTH);
        String key = "cmd:" + command + ":" + guestId + ":" + idempotencyKey;
        return idempotencyGuard.executeOnce(key, responseType, action, reservationIdOf, statusOf);
    }
}
