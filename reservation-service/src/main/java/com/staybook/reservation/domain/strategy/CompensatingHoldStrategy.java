package com.staybook.reservation.domain.strategy;

import com.staybook.reservation.domain.repository.DateCellRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Hold acquisition for stores without multi-row transactions.
 *
 * Runs outside any surrounding transaction, so every per-night UPDATE commits on its own.
 * On the first night that cannot be taken, the nights already taken by this call are
 * released again. The release only touches cells still owned by the holder, so it can be
 * retried freely; it runs under {@code ledgerCompensationRetryTemplate} with exponential backoff.
 * A release that still fails after the last retry leaves the cells held only until
 * {@code expiresAt}, after which any caller may take them over.
 */
@Slf4j
@Component("compensating")
@RequiredArgsConstructor
public class CompensatingHoldStrategy implements HoldAcquisitionStrategy {

    private final DateCellRepository repository;
    private final RetryTemplate ledgerCompensationRetryTemplate;

    @Override
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public HoldResult acquire(List<LocalDate> sortedDates, String holderId, LocalDateTime expiresAt,
                              LocalDateTime now) {
        List<LocalDate> acquired = new ArrayList<>(sortedDates.size());
        try {
            for (LocalDate date : sortedDates) {
                repository.insertIfAbsent(date, now);
                if (repository.acquire(date, holderId, expiresAt, now) == 0) {
                    List<LocalDate> blocking = repository.findBlockingDates(sortedDates, holderId, now);
                    log.debug("Cell {} unavailable for {}, compensating {} acquired cells",
                            date, holderId, acquired.size());
                    compensate(acquired, holderId, now);
                    return HoldResult.conflict(blocking.isEmpty() ? List.of(date) : blocking);
                }
                acquired.add(date);
            }
            return HoldResult.ok();
        } catch (DataAccessException e) {
            log.error("Ledger write failed while holding {} for {}, compensating", sortedDates, holderId, e);
            compensate(acquired, holderId, now);
            throw e;
        }
    }

    @Override
    public String getStrategyType() {
        return "COMPENSATING";
    }

    private void compensate(List<LocalDate> acquired, String holderId, LocalDateTime now) {
        if (acquired.isEmpty()) {
            return;
        }
        try {
            int released = ledgerCompensationRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying compensating release for {} (attempt {})", holderId, context.getRetryCount() + 1);
                }
                return repository.releaseCells(acquired, holderId, now);
            });
            log.debug("Compensating release freed {} of {} cells for {}", released, acquired.size(), holderId);
        } catch (DataAccessException e) {
            log.error("Compensating release exhausted retries for {}; cells {} stay held until their expiry",
                    holderId, acquired, e);
        }
    }
}
