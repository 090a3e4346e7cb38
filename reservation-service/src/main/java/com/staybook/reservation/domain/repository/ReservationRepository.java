package com.staybook.reservation.domain.repository;

import com.staybook.reservation.domain.model.Reservation;
import com.staybook.reservation.domain.model.Reservation.PaymentStatus;
import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Reservation status moves are guarded UPDATEs: the WHERE clause carries the expected
 * current state, and a result of 0 means another writer got there first.
 */
public interface ReservationRepository extends JpaRepository<Reservation, String> {

    List<Reservation> findByGuestIdOrderByCreatedAtDesc(String guestId);

    @Query("""
           SELECT r.id FROM Reservation r
           WHERE r.status = :status AND r.holdExpiresAt < :now
           ORDER BY r.holdExpiresAt
           """)
    List<String> findIdsWithHoldExpiredBefore(@Param("now") LocalDateTime now,
                                              @Param("status") ReservationStatus status,
                                              Pageable pageable);

    default List<String> findExpiredHoldIds(LocalDateTime now, Pageable pageable) {
        return findIdsWithHoldExpiredBefore(now, ReservationStatus.PENDING, pageable);
    }

    @Query("""
           SELECT r.id FROM Reservation r
           WHERE r.status = :status AND r.checkOut <= :today
           ORDER BY r.checkOut
           """)
    List<String> findIdsCheckingOutBy(@Param("today") LocalDate today,
                                      @Param("status") ReservationStatus status,
                                      Pageable pageable);

    /**
     * pending → confirmed, only while the hold is still live.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE Reservation r
           SET r.status = :confirmed,
               r.paymentStatus = :paid,
               r.holdExpiresAt = null,
               r.updatedAt = :now,
               r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :pending
             AND r.holdExpiresAt > :now
           """)
    int confirmIfHoldActive(@Param("id") String id,
                            @Param("now") LocalDateTime now,
                            @Param("pending") ReservationStatus pending,
                            @Param("confirmed") ReservationStatus confirmed,
                            @Param("paid") PaymentStatus paid);

    default int confirmIfHoldActive(String id, LocalDateTime now) {
        return confirmIfHoldActive(id, now, ReservationStatus.PENDING, ReservationStatus.CONFIRMED, PaymentStatus.PAID);
    }

    /**
     * pending → expired, only once the hold has elapsed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE Reservation r
           SET r.status = :expired,
               r.holdExpiresAt = null,
               r.updatedAt = :now,
               r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :pending
             AND r.holdExpiresAt < :now
           """)
    int expireIfHoldElapsed(@Param("id") String id,
                            @Param("now") LocalDateTime now,
                            @Param("pending") ReservationStatus pending,
                            @Param("expired") ReservationStatus expired);

    default int expireIfHoldElapsed(String id, LocalDateTime now) {
        return expireIfHoldElapsed(id, now, ReservationStatus.PENDING, ReservationStatus.EXPIRED);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE Reservation r
           SET r.status = :cancelled,
               r.paymentStatus = :paymentStatus,
               r.refundAmountCents = :refundAmountCents,
               r.cancellationReason = :reason,
               r.holdExpiresAt = null,
               r.updatedAt = :now,
               r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :expected
           """)
    int cancelIfStatus(@Param("id") String id,
                       @Param("expected") ReservationStatus expected,
                       @Param("cancelled") ReservationStatus cancelled,
                       @Param("paymentStatus") PaymentStatus paymentStatus,
                       @Param("refundAmountCents") Long refundAmountCents,
                       @Param("reason") String reason,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE Reservation r
           SET r.status = :completed,
               r.updatedAt = :now,
               r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :confirmed
             AND r.checkOut <= :today
           """)
    int completeIfCheckedOut(@Param("id") String id,
                             @Param("today") LocalDate today,
                             @Param("now") LocalDateTime now,
                             @Param("confirmed") ReservationStatus confirmed,
                             @Param("completed") ReservationStatus completed);

    /**
     * Payment status move guarded by the allowed source states. The reservation must still be pending.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE Reservation r
           SET r.paymentStatus = :target,
               r.updatedAt = :now,
               r.version = r.version + 1
           WHERE r.id = :id
             AND r.status = :pending
             AND r.paymentStatus IN :sources
           """)
    int movePaymentStatus(@Param("id") String id,
                          @Param("sources") Collection<PaymentStatus> sources,
                          @Param("target") PaymentStatus target,
                          @Param("now") LocalDateTime now,
                          @Param("pending") ReservationStatus pending);
}
