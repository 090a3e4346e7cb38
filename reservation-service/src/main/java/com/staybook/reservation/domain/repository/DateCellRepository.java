package com.staybook.reservation.domain.repository;

import com.staybook.reservation.domain.model.DateCell;
import com.staybook.reservation.domain.model.DateCell.CellStatus;
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
 * Conditional writes over the per-date ledger.
 *
 * Every mutating method is a single guarded UPDATE (or insert-if-absent) and returns the
 * number of affected rows, so the caller learns whether it won without taking any lock:
 * - 1 (or the size of the date set): the guard held and the row changed
 * - 0: another writer owns the row
 */
public interface DateCellRepository extends JpaRepository<DateCell, LocalDate> {

    /**
     * Materialises a FREE cell for a date that was never touched. Concurrent callers
     * for the same date are harmless: the losers insert nothing.
     */
    @Modifying
    @Transactional
    @Query(value = """
           INSERT INTO date_cells (cell_date, status, updated_at)
           VALUES (:date, 'FREE', :now)
           ON CONFLICT (cell_date) DO NOTHING
           """, nativeQuery = true)
    int insertIfAbsent(@Param("date") LocalDate date, @Param("now") LocalDateTime now);

    /**
     * FREE, or HELD with an elapsed hold, becomes HELD for {@code holder}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE DateCell c
           SET c.status = :held,
               c.holderReservationId = :holder,
               c.holdExpiresAt = :expiresAt,
               c.updatedAt = :now
           WHERE c.cellDate = :date
             AND (c.status = :free OR (c.status = :held AND c.holdExpiresAt < :now))
           """)
    int acquire(@Param("date") LocalDate date,
                @Param("holder") String holder,
                @Param("expiresAt") LocalDateTime expiresAt,
                @Param("now") LocalDateTime now,
                @Param("free") CellStatus free,
                @Param("held") CellStatus held);

    default int acquire(LocalDate date, String holder, LocalDateTime expiresAt, LocalDateTime now) {
        return acquire(date, holder, expiresAt, now, CellStatus.FREE, CellStatus.HELD);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE DateCell c
           SET c.status = :booked,
               c.holdExpiresAt = null,
               c.updatedAt = :now
           WHERE c.cellDate IN :dates
             AND c.holderReservationId = :holder
             AND c.status = :held
           """)
    int confirmCells(@Param("dates") Collection<LocalDate> dates,
                     @Param("holder") String holder,
                     @Param("now") LocalDateTime now,
                     @Param("held") CellStatus held,
                     @Param("booked") CellStatus booked);

    default int confirmCells(Collection<LocalDate> dates, String holder, LocalDateTime now) {
        return confirmCells(dates, holder, now, CellStatus.HELD, CellStatus.BOOKED);
    }

    /**
     * Returns cells of {@code holder} to FREE. Cells owned by anyone else are left alone,
     * which makes the call idempotent and safe after a takeover.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE DateCell c
           SET c.status = :free,
               c.holderReservationId = null,
               c.holdExpiresAt = null,
               c.updatedAt = :now
           WHERE c.cellDate IN :dates
             AND c.holderReservationId = :holder
           """)
    int releaseCells(@Param("dates") Collection<LocalDate> dates,
                     @Param("holder") String holder,
                     @Param("now") LocalDateTime now,
                     @Param("free") CellStatus free);

    default int releaseCells(Collection<LocalDate> dates, String holder, LocalDateTime now) {
        return releaseCells(dates, holder, now, CellStatus.FREE);
    }

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
           UPDATE DateCell c
           SET c.holderReservationId = :toHolder,
               c.updatedAt = :now
           WHERE c.cellDate IN :dates
             AND c.holderReservationId = :fromHolder
           """)
    int repointCells(@Param("dates") Collection<LocalDate> dates,
                     @Param("fromHolder") String fromHolder,
                     @Param("toHolder") String toHolder,
                     @Param("now") LocalDateTime now);

    @Query("SELECT c FROM DateCell c WHERE c.cellDate >= :from AND c.cellDate < :to ORDER BY c.cellDate")
    List<DateCell> findRange(@Param("from") LocalDate from, @Param("to") LocalDate to);

    /**
     * Dates of the given set that currently block {@code holder}: booked, or held by someone
     * else with a live hold. Dates without a cell never block.
     */
    default List<LocalDate> findBlockingDates(List<LocalDate> sortedDates, String holder, LocalDateTime now) {
        if (sortedDates.isEmpty()) {
            return List.of();
        }
        LocalDate from = sortedDates.get(0);
        LocalDate to = sortedDates.get(sortedDates.size() - 1).plusDays(1);
        return findRange(from, to).stream()
                .filter(cell -> sortedDates.contains(cell.getCellDate()))
                .filter(cell -> !cell.isHeldBy(holder) && cell.isBlocking(now))
                .map(DateCell::getCellDate)
                .toList();
    }

    @Query("SELECT COUNT(c) FROM DateCell c WHERE c.cellDate IN :dates AND c.holderReservationId = :holder AND c.status = :status")
    long countHeldBy(@Param("dates") Collection<LocalDate> dates,
                     @Param("holder") String holder,
                     @Param("status") CellStatus status);
}
