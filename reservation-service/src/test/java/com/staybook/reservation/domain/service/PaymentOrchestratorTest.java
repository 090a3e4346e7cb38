package com.staybook.reservation.domain.service;

import com.staybook.common.exception.BusinessException;
import com.staybook.reservation.client.PaymentGatewayAdapter;
import com.staybook.reservation.client.dto.CheckoutSessionResponse;
import com.staybook.reservation.client.dto.CreateCheckoutSessionRequest;
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
import com.staybook.reservation.exception.MaxAttemptsExceededException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link PaymentOrchestrator} – attempt limits, checkout session creation and
 * outcome dominance (succeeded wins over failed).
 */
@ExtendWith(MockitoExtension.class)
class PaymentOrchestratorTest {

    private static final Instant INSTANT = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(INSTANT, ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private PaymentAttemptRepository attemptRepository;
    @Mock
    private ReservationManager reservationManager;
    @Mock
    private PaymentGatewayAdapter paymentGateway;

    private PaymentOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new PaymentOrchestrator(attemptRepository, reservationManager, paymentGateway, CLOCK);
        ReflectionTestUtils.setField(orchestrator, "maxAttempts", 3);
        ReflectionTestUtils.setField(orchestrator, "currency", "usd");
        ReflectionTestUtils.setField(orchestrator, "attemptTtlMinutes", 30L);
    }

    @Test
    @DisplayName("createAttempt: first attempt opens a checkout session for the reservation total")
    void createAttempt_first_opensSession() {
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.PENDING, PaymentStatus.NONE));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1")).thenReturn(Optional.empty());
        when(attemptRepository.saveAndFlush(any(PaymentAttempt.class))).thenAnswer(inv -> inv.getArgument(0));
        when(attemptRepository.save(any(PaymentAttempt.class))).thenAnswer(inv -> inv.getArgument(0));
        long expiresAt = INSTANT.plusSeconds(1800).getEpochSecond();
        when(paymentGateway.createCheckoutSession(any(CreateCheckoutSessionRequest.class)))
                .thenReturn(new CheckoutSessionResponse("cs_1", "https://pay.example/cs_1", expiresAt));

        PaymentAttempt attempt = orchestrator.createAttempt("RES-1");

        assertThat(attempt.getAttemptNumber()).isEqualTo(1);
        assertThat(attempt.getAmountCents()).isEqualTo(63_000L);
        assertThat(attempt.getExternalSessionId()).isEqualTo("cs_1");
        assertThat(attempt.getCheckoutUrl()).isEqualTo("https://pay.example/cs_1");
        assertThat(attempt.getAttemptExpiresAt()).isEqualTo(NOW.plusMinutes(30));
        verify(paymentGateway).createCheckoutSession(argThat(request ->
                request.amountCents() == 63_000L
                        && request.idempotencyKey().equals(attempt.getId())
                        && request.expiresInSeconds() == 1800));
        verify(attemptRepository).expireOpenAttempts("RES-1", NOW);
        verify(reservationManager).markPaymentPending("RES-1");
    }

    @Test
    @DisplayName("createAttempt: retry while payment already pending does not move the payment status again")
    void createAttempt_paymentAlreadyPending_noStatusMove() {
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.PENDING, PaymentStatus.PENDING));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1"))
                .thenReturn(Optional.of(attempt(1, AttemptStatus.CREATED)));
        when(attemptRepository.saveAndFlush(any(PaymentAttempt.class))).thenAnswer(inv -> inv.getArgument(0));
        when(attemptRepository.save(any(PaymentAttempt.class))).thenAnswer(inv -> inv.getArgument(0));
        when(paymentGateway.createCheckoutSession(any())).thenReturn(new CheckoutSessionResponse("cs_2", "u", null));

        PaymentAttempt attempt = orchestrator.createAttempt("RES-1");

        assertThat(attempt.getAttemptNumber()).isEqualTo(2);
        assertThat(attempt.getAttemptExpiresAt()).isEqualTo(NOW.plusMinutes(30));
        verify(reservationManager, never()).markPaymentPending(anyString());
    }

    @Test
    @DisplayName("createAttempt: fourth attempt refused with MaxAttemptsExceededException, gateway not called")
    void createAttempt_afterThree_refused() {
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.PENDING, PaymentStatus.FAILED));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1"))
                .thenReturn(Optional.of(attempt(3, AttemptStatus.FAILED)));

        assertThatThrownBy(() -> orchestrator.createAttempt("RES-1"))
                .isInstanceOf(MaxAttemptsExceededException.class)
                .hasMessage("Maximum 3 payment attempts exceeded. Please contact support.");
        verifyNoInteractions(paymentGateway);
        verify(attemptRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("createAttempt: elapsed hold refused")
    void createAttempt_elapsedHold_refused() {
        Reservation reservation = reservation(ReservationStatus.PENDING, PaymentStatus.NONE);
        reservation.setHoldExpiresAt(NOW.minusMinutes(1));
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation);

        assertThatThrownBy(() -> orchestrator.createAttempt("RES-1")).isInstanceOf(ExpiredHoldException.class);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("createAttempt: racing request for the same attempt number loses on the unique key")
    void createAttempt_concurrent_rejected() {
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.PENDING, PaymentStatus.NONE));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1")).thenReturn(Optional.empty());
        when(attemptRepository.saveAndFlush(any(PaymentAttempt.class)))
                .thenThrow(new DataIntegrityViolationException("uk_payment_attempts_reservation_number"));

        assertThatThrownBy(() -> orchestrator.createAttempt("RES-1"))
                .isInstanceOf(BusinessException.class)
                .extracting("errorCode").isEqualTo(PaymentOrchestrator.CONCURRENT_ATTEMPT);
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("applyOutcome: success within the hold confirms the reservation")
    void applyOutcome_success_confirms() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.CREATED)));
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.PENDING, PaymentStatus.PENDING));
        when(attemptRepository.transition(eq("PAY-1"), anyCollection(), eq(AttemptStatus.SUCCEEDED), eq(NOW))).thenReturn(1);

        Disposition disposition = orchestrator.applyOutcome("PAY-1", success(63_000L));

        assertThat(disposition).isEqualTo(Disposition.APPLIED);
        verify(attemptRepository).expireOpenAttempts("RES-1", NOW);
        verify(reservationManager).confirmFromPayment("RES-1", "PAY-1");
    }

    @Test
    @DisplayName("applyOutcome: success after failure of the same attempt is still applied")
    void applyOutcome_successAfterFailure_applied() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.FAILED)));
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.PENDING, PaymentStatus.FAILED));
        when(attemptRepository.transition(eq("PAY-1"), argThat(sources -> sources.contains(AttemptStatus.FAILED)),
                eq(AttemptStatus.SUCCEEDED), eq(NOW))).thenReturn(1);

        assertThat(orchestrator.applyOutcome("PAY-1", success(63_000L))).isEqualTo(Disposition.APPLIED);
        verify(reservationManager).confirmFromPayment("RES-1", "PAY-1");
    }

    @Test
    @DisplayName("applyOutcome: failure after success is ignored")
    void applyOutcome_failureAfterSuccess_ignored() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.SUCCEEDED)));

        Disposition disposition = orchestrator.applyOutcome("PAY-1",
                new PaymentEvent("evt-2", "cs_1", PaymentOutcome.FAILED, null));

        assertThat(disposition).isEqualTo(Disposition.IGNORED);
        verify(attemptRepository, never()).transition(anyString(), anyCollection(), any(), any());
        verify(reservationManager, never()).markPaymentFailed(anyString());
    }

    @Test
    @DisplayName("applyOutcome: failure of an open attempt marks the payment failed")
    void applyOutcome_failure_marksFailed() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.PROCESSING)));
        when(attemptRepository.transition(eq("PAY-1"), anyCollection(), eq(AttemptStatus.FAILED), eq(NOW))).thenReturn(1);

        Disposition disposition = orchestrator.applyOutcome("PAY-1",
                new PaymentEvent("evt-3", "cs_1", PaymentOutcome.FAILED, null));

        assertThat(disposition).isEqualTo(Disposition.APPLIED);
        verify(reservationManager).markPaymentFailed("RES-1");
    }

    @Test
    @DisplayName("applyOutcome: reported amount differs from the attempt, nothing applied")
    void applyOutcome_amountMismatch_throws() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.CREATED)));

        assertThatThrownBy(() -> orchestrator.applyOutcome("PAY-1", success(1_000L)))
                .isInstanceOf(AmountMismatchException.class);
        verify(attemptRepository, never()).transition(anyString(), anyCollection(), any(), any());
        verify(reservationManager, never()).confirmFromPayment(anyString(), anyString());
    }

    @Test
    @DisplayName("applyOutcome: success for an expired reservation is a late payment conflict")
    void applyOutcome_successAfterExpiry_latePayment() {
        Reservation expired = reservation(ReservationStatus.EXPIRED, PaymentStatus.PENDING);
        expired.setHoldExpiresAt(null);
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.EXPIRED)));
        when(reservationManager.getReservation("RES-1")).thenReturn(expired);

        assertThatThrownBy(() -> orchestrator.applyOutcome("PAY-1", success(63_000L)))
                .isInstanceOf(ReconciliationConflictException.class)
                .extracting("reason").isEqualTo(ConflictReason.LATE_PAYMENT);
        verify(reservationManager, never()).confirmFromPayment(anyString(), anyString());
    }

    @Test
    @DisplayName("applyOutcome: second successful attempt for a confirmed reservation is a duplicate payment")
    void applyOutcome_secondSuccess_duplicatePayment() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.EXPIRED)));
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.CONFIRMED, PaymentStatus.PAID));
        when(attemptRepository.findCurrentStatus("PAY-1")).thenReturn(Optional.of(AttemptStatus.EXPIRED));

        assertThatThrownBy(() -> orchestrator.applyOutcome("PAY-1", success(63_000L)))
                .isInstanceOf(ReconciliationConflictException.class)
                .extracting("reason").isEqualTo(ConflictReason.DUPLICATE_PAYMENT);
    }

    @Test
    @DisplayName("applyOutcome: attempt already confirmed the reservation in a concurrent commit, event ignored")
    void applyOutcome_staleAttemptAlreadySucceeded_ignored() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.CREATED)));
        when(reservationManager.getReservation("RES-1")).thenReturn(reservation(ReservationStatus.CONFIRMED, PaymentStatus.PAID));
        when(attemptRepository.findCurrentStatus("PAY-1")).thenReturn(Optional.of(AttemptStatus.SUCCEEDED));

        Disposition disposition = orchestrator.applyOutcome("PAY-1", success(63_000L));

        assertThat(disposition).isEqualTo(Disposition.IGNORED);
        verify(attemptRepository, never()).transition(anyString(), anyCollection(), any(), any());
        verify(reservationManager, never()).confirmFromPayment(anyString(), anyString());
    }

    @Test
    @DisplayName("applyOutcome: success without an amount is treated as a mismatch")
    void applyOutcome_successWithoutAmount_mismatch() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.CREATED)));

        assertThatThrownBy(() -> orchestrator.applyOutcome("PAY-1", success(null)))
                .isInstanceOf(AmountMismatchException.class);
        verify(reservationManager, never()).confirmFromPayment(anyString(), anyString());
    }

    @Test
    @DisplayName("expireLapsedAttempt: open attempt expired and payment marked failed; closed attempt untouched")
    void expireLapsedAttempt_onlyOpen() {
        when(attemptRepository.findById("PAY-1")).thenReturn(Optional.of(attempt(1, AttemptStatus.CREATED)));
        when(attemptRepository.transition(eq("PAY-1"), anyCollection(), eq(AttemptStatus.EXPIRED), eq(NOW)))
                .thenReturn(1, 0);

        assertThat(orchestrator.expireLapsedAttempt("PAY-1")).isTrue();
        assertThat(orchestrator.expireLapsedAttempt("PAY-1")).isFalse();
        verify(reservationManager, times(1)).markPaymentFailed("RES-1");
    }

    private static PaymentEvent success(Long amountCents) {
        return new PaymentEvent("evt-1", "cs_1", PaymentOutcome.SUCCEEDED, amountCents);
    }

    private static Reservation reservation(ReservationStatus status, PaymentStatus paymentStatus) {
        return Reservation.builder()
                .id("RES-1")
                .guestId("guest-1")
                .checkIn(LocalDate.of(2026, 3, 21))
                .checkOut(LocalDate.of(2026, 3, 24))
                .guestCount(2)
                .nights(3)
                .nightlyRateCents(18_500L)
                .cleaningFeeCents(7_500L)
                .totalAmountCents(63_000L)
                .status(status)
                .paymentStatus(paymentStatus)
                .holdExpiresAt(NOW.plusMinutes(20))
                .createdAt(NOW.minusMinutes(10))
                .updatedAt(NOW.minusMinutes(10))
                .build();
    }

    private static PaymentAttempt attempt(int number, AttemptStatus status) {
        return PaymentAttempt.builder()
                .id("PAY-" + number)
                .reservationId("RES-1")
                .attemptNumber(number)
                .status(status)
                .externalSessionId("cs_" + number)
                .amountCents(63_000L)
                .currency("usd")
                .createdAt(NOW.minusMinutes(5))
                .updatedAt(NOW.minusMinutes(5))
                .build();
    }
}
