package com.staybook.reservation.domain.strategy;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Acquires a set of ledger cells for one holder, all or nothing.
 *
 * Implementations (bean names):
 * - transactional: every cell in one database transaction, rolled back as a whole on conflict
 * - compensating: each cell committed on its own, already acquired cells released on conflict
 *
 * Selected with {@code stay.ledger.acquire-strategy}.
 */
public interface HoldAcquisitionStrategy {

    /**
     * @param sortedDates nights to hold, ascending
     * @param holderId    reservation id (or a temporary marker) that will own the cells
     * @param expiresAt   hold expiry written to every cell
     * @param now         current time; holds expiring before it can be taken over
     * @return ok, or the dates that blocked the attempt. On conflict no cell of
     *         {@code sortedDates} is left held by {@code holderId} from this call.
     */
    HoldResult acquire(List<LocalDate> sortedDates, String holderId, LocalDateTime expiresAt, LocalDateTime now);

    String getStrategyType();
}
