package com.staybook.reservation.domain.strategy;

import com.staybook.reservation.domain.repository.DateCellRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Hold acquisition as one multi-row database transaction.
 *
 * Each night is taken with a single guarded UPDATE:
 *
 *   UPDATE date_cells SET status = 'HELD', holder_reservation_id = :holder, ...
 *   WHERE cell_date = :date
 *     AND (status = 'FREE' OR (status = 'HELD' AND hold_expires_at < :now));
 *
 * If any UPDATE affects 0 rows the transaction is rolled back, so either every night
 * is held or none is. Nights are processed in ascending order, which keeps concurrent
 * transactions from locking the same rows in opposite orders.
 */
@Slf4j
@Component("transactional")
@RequiredArgsConstructor
public class TransactionalHoldStrategy implements HoldAcquisitionStrategy {

    private final DateCellRepository repository;

    @Override
    @Transactional
    public HoldResult acquire(List<LocalDate> sortedDates, String holderId, LocalDateTime expiresAt,
                              LocalDateTime now) {
        for (LocalDate date : sortedDates) {
            repository.insertIfAbsent(date, now);
        }

        for (LocalDate date : sortedDates) {
            int updatedRows = repository.acquire(date, holderId, expiresAt, now);
            if (updatedRows == 0) {
                List<LocalDate> blocking = repository.findBlockingDates(sortedDates, holderId, now);
                log.debug("Cell {} unavailable for {}, rolling back hold of {} nights",
                        date, holderId, sortedDates.size());
                throw new HoldConflictException(blocking.isEmpty() ? List.of(date) : blocking);
            }
            log.debug("Held cell {} for {} until {}", date, holderId, expiresAt);
        }
        return HoldResult.ok();
    }

    @Override
    public String getStrategyType() {
        return "TRANSACTIONAL";
    }
}
