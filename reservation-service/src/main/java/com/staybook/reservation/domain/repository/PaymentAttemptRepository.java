package com.staybook.reservation.domain.repository;

import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.model.PaymentAttempt.AttemptStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface PaymentAttemptRepository extends JpaRepository<PaymentAttempt, String> {

    List<PaymentAttempt> findByReservationIdOrderByAttemptNumberAsc(String reservationId);

    Optional<PaymentAttempt> findTopByReservationIdOrderByAttemptNumberDesc(String reservationId);

    Optional<PaymentAttempt> findByExternalSessionId(String externalSessionId);

    /**
     * Status as committed in the database, bypassing the entity already loaded in the persistence context.
     */
    @Query("SELECT a.status FROM PaymentAttempt a WHERE a.id = :id")
    Optional<AttemptStatus> findCurrentStatus(@Param("id") String id);

    /**
     * Moves the attempt to {@code target} if its current status is one of {@code sources}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE PaymentAttempt a
           SET a.status = :target,
               a.updatedAt = :now,
               a.version = a.version + 1
           WHERE a.id = :id
             AND a.status IN :sources
           """)
    int transition(@Param("id") String id,
                   @Param("sources") Collection<AttemptStatus> sources,
                   @Param("target") AttemptStatus target,
                   @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE PaymentAttempt a
           SET a.status = :expired,
               a.updatedAt = :now,
               a.version = a.version + 1
           WHERE a.reservationId = :reservationId
             AND a.status IN :open
           """)
    int expireOpenAttempts(@Param("reservationId") String reservationId,
                           @Param("now") LocalDateTime now,
                           @Param("open") Collection<AttemptStatus> open,
                           @Param("expired") AttemptStatus expired);

    default int expireOpenAttempts(String reservationId, LocalDateTime now) {
        return expireOpenAttempts(reservationId, now,
                List.of(AttemptStatus.CREATED, AttemptStatus.PROCESSING), AttemptStatus.EXPIRED);
    }

    @Query("""
           SELECT a FROM PaymentAttempt a
           WHERE a.status IN :open AND a.attemptExpiresAt < :now
           ORDER BY a.attemptExpiresAt
           """)
    List<PaymentAttempt> findOpenExpiredBefore(@Param("now") LocalDateTime now,
                                               @Param("open") Collection<AttemptStatus> open);
}
