package com.staybook.reservation.domain.repository;

import com.staybook.reservation.domain.model.IdempotencyRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecord, String> {

    /**
     * Claims a key. Returns 1 for the first caller and 0 for everyone after it; a concurrent
     * caller blocks on the unique index until the first transaction commits or rolls back.
     */
    @Modifying
    @Transactional
    @Query(value = """
           INSERT INTO idempotency_records (idempotency_key, record_type, reservation_id, processed_at)
           VALUES (:key, :recordType, :reservationId, :now)
           ON CONFLICT (idempotency_key) DO NOTHING
           """, nativeQuery = true)
    int insertIfAbsent(@Param("key") String key,
                       @Param("recordType") String recordType,
                       @Param("reservationId") String reservationId,
                       @Param("now") LocalDateTime now);
}
