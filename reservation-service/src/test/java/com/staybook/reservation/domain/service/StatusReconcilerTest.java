package com.staybook.reservation.domain.service;

import com.staybook.common.exception.ResourceNotFoundException;
import com.staybook.reservation.client.PaymentGatewayAdapter;
import com.staybook.reservation.client.dto.SessionStatusResponse;
import com.staybook.reservation.domain.model.IdempotencyRecord;
import com.staybook.reservation.domain.model.IdempotencyRecord.RecordType;
import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.PaymentAttempt.AttemptStatus;
import com.staybook.reservation.domain.model.PaymentEvent;
import com.staybook.reservation.domain.model.PaymentOutcome;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictReason;
import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.model.Reservation.PaymentStatus;
import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import com.staybook.reservation.domain.repository.PaymentAttemptRepository;
import com.staybook.reservation.domain.repository.ReservationRepository;
import com.staybook.reservation.domain.service.ReconciliationResult.Disposition;
import com.staybook.reservation.domain.service.StatusReconciler.Channel;
import com.staybook.reservation.exception.AmountMismatchException;
import com.staybook.reservation.exception.ReconciliationConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link StatusReconciler} – exactly-once ingestion of webhook and poll outcomes,
 * and conflict recording for payments that can no longer be applied.
 */
@ExtendWith(MockitoExtension.class)
class StatusReconcilerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final PaymentEvent SUCCESS = new PaymentEvent("evt-1", "cs_1", PaymentOutcome.SUCCEEDED, 63_000L);

    @Mock
    private IdempotencyGuard idempotencyGuard;
    @Mock
    private PaymentAttemptRepository attemptRepository;
    @Mock
    private ReservationRepository reservationRepository;
    @Mock
    private PaymentOrchestrator paymentOrchestrator;
    @Mock
    private ReconciliationConflictService conflictService;
    @Mock
    private PaymentGatewayAdapter paymentGateway;
    @Mock
    private PollThrottle pollThrottle;

    @InjectMocks
    private StatusReconciler reconciler;

    @Test
    @DisplayName("ingest: first delivery applies the outcome and records it under the event key")
    void ingest_firstDelivery_applies() {
        when(attemptRepository.findByExternalSessionId("cs_1")).thenReturn(Optional.of(attempt()));
        when(idempotencyGuard.recordIfNew("event:evt-1", RecordType.EVENT, "RES-1")).thenReturn(true);
        when(paymentOrchestrator.applyOutcome("PAY-1", SUCCESS)).thenReturn(Disposition.APPLIED);
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.CONFIRMED)));

        ReconciliationResult result = reconciler.ingest(SUCCESS, Channel.WEBHOOK);

        assertThat(result.disposition()).isEqualTo(Disposition.APPLIED);
        assertThat(result.reservationStatus()).isEqualTo("CONFIRMED");
        verify(idempotencyGuard).complete("event:evt-1", "RES-1", "APPLIED", "CONFIRMED", null);
    }

    @Test
    @DisplayName("ingest: redelivered event is acknowledged as duplicate with the first outcome, nothing applied")
    void ingest_duplicate_returnsPriorOutcome() {
        IdempotencyRecord prior = IdempotencyRecord.builder()
                .idempotencyKey("event:evt-1")
                .recordType(RecordType.EVENT)
                .reservationId("RES-1")
                .outcome("APPLIED")
                .resultingReservationStatus("CONFIRMED")
                .processedAt(NOW)
                .build();
        when(attemptRepository.findByExternalSessionId("cs_1")).thenReturn(Optional.of(attempt()));
        when(idempotencyGuard.recordIfNew("event:evt-1", RecordType.EVENT, "RES-1")).thenReturn(false);
        when(idempotencyGuard.find("event:evt-1")).thenReturn(Optional.of(prior));
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.CONFIRMED)));

        ReconciliationResult result = reconciler.ingest(SUCCESS, Channel.WEBHOOK);

        assertThat(result.disposition()).isEqualTo(Disposition.DUPLICATE);
        assertThat(result.recordedOutcome()).isEqualTo("APPLIED");
        verifyNoInteractions(paymentOrchestrator, conflictService);
        verify(idempotencyGuard, never()).complete(anyString(), anyString(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("ingest: success after expiry is stored as a late payment conflict and rethrown with its id")
    void ingest_lateSuccess_recordsConflict() {
        PaymentAttempt attempt = attempt();
        ReconciliationConflictRecord stored = ReconciliationConflictRecord.builder().id(42L)
                .reason(ConflictReason.LATE_PAYMENT).build();
        when(attemptRepository.findByExternalSessionId("cs_1")).thenReturn(Optional.of(attempt));
        when(idempotencyGuard.recordIfNew("event:evt-1", RecordType.EVENT, "RES-1")).thenReturn(true);
        when(paymentOrchestrator.applyOutcome("PAY-1", SUCCESS))
                .thenThrow(new ReconciliationConflictException("RES-1", "PAY-1", ConflictReason.LATE_PAYMENT));
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.EXPIRED)));
        when(conflictService.record(SUCCESS, attempt, ConflictReason.LATE_PAYMENT, Channel.WEBHOOK, "EXPIRED"))
                .thenReturn(stored);

        assertThatThrownBy(() -> reconciler.ingest(SUCCESS, Channel.WEBHOOK))
                .isInstanceOf(ReconciliationConflictException.class)
                .extracting("conflictId").isEqualTo(42L);
        verify(idempotencyGuard).complete("event:evt-1", "RES-1", StatusReconciler.CONFLICT_OUTCOME, "EXPIRED", null);
    }

    @Test
    @DisplayName("ingest: amount mismatch is stored as a conflict and rethrown")
    void ingest_amountMismatch_recordsConflict() {
        PaymentAttempt attempt = attempt();
        when(attemptRepository.findByExternalSessionId("cs_1")).thenReturn(Optional.of(attempt));
        when(idempotencyGuard.recordIfNew("event:evt-1", RecordType.EVENT, "RES-1")).thenReturn(true);
        when(paymentOrchestrator.applyOutcome("PAY-1", SUCCESS)).thenThrow(new AmountMismatchException(63_000L, 60_000L));
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.PENDING)));
        when(conflictService.record(SUCCESS, attempt, ConflictReason.AMOUNT_MISMATCH, Channel.WEBHOOK, "PENDING"))
                .thenReturn(ReconciliationConflictRecord.builder().id(7L).build());

        assertThatThrownBy(() -> reconciler.ingest(SUCCESS, Channel.WEBHOOK))
                .isInstanceOf(AmountMismatchException.class);
        verify(idempotencyGuard).complete("event:evt-1", "RES-1", StatusReconciler.CONFLICT_OUTCOME, "PENDING", null);
    }

    @Test
    @DisplayName("ingest: unknown checkout session is not found, key not claimed")
    void ingest_unknownSession_notFound() {
        when(attemptRepository.findByExternalSessionId("cs_1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> reconciler.ingest(SUCCESS, Channel.WEBHOOK))
                .isInstanceOf(ResourceNotFoundException.class);
        verifyNoInteractions(idempotencyGuard);
    }

    @Test
    @DisplayName("poll: terminal gateway status is ingested under a key derived from session and outcome")
    void poll_terminalStatus_ingested() {
        Reservation pending = reservation(ReservationStatus.PENDING);
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(pending));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1")).thenReturn(Optional.of(attempt()));
        when(pollThrottle.tryAcquire("RES-1")).thenReturn(true);
        when(paymentGateway.getSessionStatus("cs_1"))
                .thenReturn(new SessionStatusResponse("cs_1", "complete", "paid", 63_000L));
        when(attemptRepository.findByExternalSessionId("cs_1")).thenReturn(Optional.of(attempt()));
        when(idempotencyGuard.recordIfNew("event:poll:cs_1:succeeded", RecordType.EVENT, "RES-1")).thenReturn(true);
        when(paymentOrchestrator.applyOutcome(eq("PAY-1"), any(PaymentEvent.class))).thenReturn(Disposition.APPLIED);

        PollResult result = reconciler.poll("RES-1");

        assertThat(result.pulled()).isTrue();
        assertThat(result.throttled()).isFalse();
        verify(paymentOrchestrator).applyOutcome(eq("PAY-1"), argThat(event ->
                event.eventKey().equals("poll:cs_1:succeeded")
                        && event.outcome() == PaymentOutcome.SUCCEEDED
                        && event.amountCents() == 63_000L));
    }

    @Test
    @DisplayName("poll: within the minimum interval the gateway is not asked")
    void poll_throttled_noGatewayCall() {
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.PENDING)));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1")).thenReturn(Optional.of(attempt()));
        when(pollThrottle.tryAcquire("RES-1")).thenReturn(false);

        PollResult result = reconciler.poll("RES-1");

        assertThat(result.throttled()).isTrue();
        assertThat(result.pulled()).isFalse();
        verifyNoInteractions(paymentGateway);
    }

    @Test
    @DisplayName("poll: open session leaves state untouched")
    void poll_openSession_nothingIngested() {
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.PENDING)));
        when(attemptRepository.findTopByReservationIdOrderByAttemptNumberDesc("RES-1")).thenReturn(Optional.of(attempt()));
        when(pollThrottle.tryAcquire("RES-1")).thenReturn(true);
        when(paymentGateway.getSessionStatus("cs_1")).thenReturn(new SessionStatusResponse("cs_1", "open", "unpaid", null));

        PollResult result = reconciler.poll("RES-1");

        assertThat(result.pulled()).isTrue();
        verifyNoInteractions(idempotencyGuard, paymentOrchestrator);
    }

    @Test
    @DisplayName("poll: settled reservation answered from storage without throttle or gateway")
    void poll_confirmed_answeredLocally() {
        when(reservationRepository.findById("RES-1")).thenReturn(Optional.of(reservation(ReservationStatus.CONFIRMED)));

        PollResult result = reconciler.poll("RES-1");

        assertThat(result.reservation().getStatus()).isEqualTo(ReservationStatus.CONFIRMED);
        verifyNoInteractions(pollThrottle, paymentGateway);
    }

    private static PaymentAttempt attempt() {
        return PaymentAttempt.builder()
                .id("PAY-1")
                .reservationId("RES-1")
                .attemptNumber(1)
                .status(AttemptStatus.CREATED)
                .externalSessionId("cs_1")
                .amountCents(63_000L)
                .currency("usd")
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static Reservation reservation(ReservationStatus status) {
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
                .paymentStatus(PaymentStatus.PENDING)
                .holdExpiresAt(NOW.plusMinutes(20))
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }
}
