package com.staybook.reservation.domain.service;

import com.staybook.common.exception.BusinessException;
import com.staybook.common.exception.ResourceNotFoundException;
import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.PaymentEvent;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictReason;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictStatus;
import com.staybook.reservation.domain.repository.ReconciliationConflictRepository;
import com.staybook.reservation.events.ReservationEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Book of payment outcomes that need a human or a refund job to settle them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationConflictService {

    public static final String CONFLICT_ALREADY_RESOLVED = "CONFLICT_ALREADY_RESOLVED";

    private final ReconciliationConflictRepository repository;
    private final ReservationEventPublisher eventPublisher;
    private final Clock clock;

    @Transactional
    public ReconciliationConflictRecord record(PaymentEvent event, PaymentAttempt attempt, ConflictReason reason,
                                               StatusReconciler.Channel channel, String reservationStatus) {
        ReconciliationConflictRecord conflict = ReconciliationConflictRecord.builder()
                .eventKey(event.eventKey())
                .reservationId(attempt.getReservationId())
                .paymentAttemptId(attempt.getId())
                .externalSessionId(event.externalSessionId())
                .reason(reason)
                .reportedAmountCents(event.amountCents())
                .expectedAmountCents(attempt.getAmountCents())
                .reservationStatus(reservationStatus)
                .channel(channel.name())
                .status(ConflictStatus.OPEN)
                .createdAt(LocalDateTime.now(clock))
                .build();
        conflict = repository.save(conflict);
        log.warn("Reconciliation conflict {} recorded: {} for attempt {} of reservation {} (status {}) via {}",
                conflict.getId(), reason, attempt.getId(), attempt.getReservationId(), reservationStatus, channel);
        eventPublisher.publishReconciliationConflict(conflict);
        return conflict;
    }

    @Transactional(readOnly = true)
    public List<ReconciliationConflictRecord> findByStatus(ConflictStatus status) {
        return repository.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional
    public ReconciliationConflictRecord resolve(Long conflictId, String resolutionNote) {
        ReconciliationConflictRecord conflict = repository.findById(conflictId)
                .orElseThrow(() -> new ResourceNotFoundException("Reconciliation conflict", conflictId));
        if (conflict.getStatus() == ConflictStatus.RESOLVED) {
            throw new BusinessException(
                    String.format("Reconciliation conflict %d is already resolved", conflictId), CONFLICT_ALREADY_RESOLVED);
        }
        conflict.setStatus(ConflictStatus.RESOLVED);
        conflict.setResolutionNote(resolutionNote);
        conflict.setResolvedAt(LocalDateTime.now(clock));
        log.info("Reconciliation conflict {} resolved: {}", conflictId, resolutionNote);
        return repository.save(conflict);
    }
}
