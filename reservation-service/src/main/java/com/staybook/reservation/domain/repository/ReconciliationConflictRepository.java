package com.staybook.reservation.domain.repository;

import com.staybook.reservation.domain.model.ReconciliationConflictRecord;
import com.staybook.reservation.domain.model.ReconciliationConflictRecord.ConflictStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReconciliationConflictRepository extends JpaRepository<ReconciliationConflictRecord, Long> {

    List<ReconciliationConflictRecord> findByStatusOrderByCreatedAtAsc(ConflictStatus status);

    List<ReconciliationConflictRecord> findByReservationIdOrderByCreatedAtAsc(String reservationId);
}
