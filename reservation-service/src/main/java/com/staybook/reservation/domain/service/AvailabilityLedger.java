package com.staybook.reservation.domain.service;

import com.staybook.reservation.domain.model.DateCell.CellStatus;
import com.staybook.reservation.domain.model.DateRange;
import com.staybook.reservation.domain.repository.DateCellRepository;
import com.staybook.reservation.domain.strategy.HoldAcquisitionStrategy;
import com.staybook.reservation.domain.strategy.HoldConflictException;
import com.staybook.reservation.domain.strategy.HoldResult;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Single owner of the per-date ledger. Nothing else writes {@code date_cells}.
 *
 * Hold acquisition is delegated to a {@link HoldAcquisitionStrategy} picked from the
 * Spring-injected map by bean name ({@code stay.ledger.acquire-strategy}). A conflict under
 * the transactional strategy marks any surrounding transaction rollback-only, so callers
 * must fail their own unit of work when {@link HoldResult#acquired()} is false.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityLedger {

    private final Map<String, HoldAcquisitionStrategy> acquisitionStrategies;
    private final DateCellRepository repository;
    private final AlternativeDateFinder alternativeDateFinder;
    private final Clock clock;

    @Value("${stay.ledger.acquire-strategy:transactional}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized AvailabilityLedger with strategy: {}", getAcquisitionStrategy().getStrategyType());
    }

    /**
     * Holds every night of the range until {@code expiresAt}, or none of them.
     */
    public HoldResult acquireHold(DateRange range, String holderId, LocalDateTime expiresAt) {
        return acquire(range.dates(), holderId, expiresAt, LocalDateTime.now(clock));
    }

    /**
     * Holds an arbitrary set of nights until {@code expiresAt}. Used when a reservation moves
     * and only the nights outside its current range are needed.
     */
    public HoldResult acquireDates(List<LocalDate> dates, String holderId, LocalDateTime expiresAt) {
        List<LocalDate> sorted = dates.stream().sorted().toList();
        return acquire(sorted, holderId, expiresAt, LocalDateTime.now(clock));
    }

    private HoldResult acquire(List<LocalDate> sortedDates, String holderId, LocalDateTime expiresAt,
                               LocalDateTime now) {
        if (sortedDates.isEmpty()) {
            return HoldResult.ok();
        }
        HoldAcquisitionStrategy strategy = getAcquisitionStrategy();
        try {
            HoldResult result = strategy.acquire(sortedDates, holderId, expiresAt, now);
            if (result.acquired()) {
                log.debug("Held {} nights from {} for {} until {}", sortedDates.size(), sortedDates.get(0),
                        holderId, expiresAt);
            } else {
                log.warn("Hold for {} rejected, conflicting dates {}", holderId, result.conflictingDates());
            }
            return result;
        } catch (HoldConflictException e) {
            log.warn("Hold for {} rolled back, conflicting dates {}", holderId, e.getConflictingDates());
            return HoldResult.conflict(e.getConflictingDates());
        }
    }

    /**
     * HELD → BOOKED for every night of the range held by {@code holderId}.
     *
     * @return true when the whole range is booked by the holder afterwards, including when it
     *         already was; false when some night belongs to someone else
     */
    @Transactional
    public boolean confirm(DateRange range, String holderId) {
        List<LocalDate> dates = range.dates();
        int updated = repository.confirmCells(dates, holderId, LocalDateTime.now(clock));
        long booked = repository.countHeldBy(dates, holderId, CellStatus.BOOKED);
        log.debug("Confirm {} for {}: {} cells moved, {} of {} booked", range, holderId, updated, booked, dates.size());
        return booked == dates.size();
    }

    /**
     * Frees every night of the range still owned by {@code holderId}. Idempotent.
     */
    public int release(DateRange range, String holderId) {
        return releaseDates(range.dates(), holderId);
    }

    public int releaseDates(Collection<LocalDate> dates, String holderId) {
        if (dates.isEmpty()) {
            return 0;
        }
        int released = repository.releaseCells(dates, holderId, LocalDateTime.now(clock));
        log.debug("Released {} cells for {}", released, holderId);
        return released;
    }

    public int repoint(Collection<LocalDate> dates, String fromHolder, String toHolder) {
        if (dates.isEmpty()) {
            return 0;
        }
        return repository.repointCells(dates, fromHolder, toHolder, LocalDateTime.now(clock));
    }

    /**
     * Snapshot read, no locks: nights of the range that are booked or under a live hold.
     */
    @Transactional(readOnly = true)
    public List<LocalDate> findConflicts(DateRange range) {
        return repository.findBlockingDates(range.dates(), null, LocalDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public List<DateRange> suggestAlternatives(DateRange requested, int maxResults) {
        return alternativeDateFinder.findAlternatives(requested, LocalDateTime.now(clock), maxResults);
    }

    private HoldAcquisitionStrategy getAcquisitionStrategy() {
        HoldAcquisitionStrategy strategy = acquisitionStrategies.get(strategyType);
        if (strategy == null) {
            log.warn("Unknown acquisition strategy: {}. Falling back to transactional.", strategyType);
            return acquisitionStrategies.get("transactional");
        }
        return strategy;
    }
}
