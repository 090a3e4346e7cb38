package com.staybook.reservation.job;

import com.staybook.reservation.domain.model.PaymentAttempt;
import com.staybook.reservation.domain.repository.ReservationRepository;
import com.staybook.reservation.domain.service.PaymentOrchestrator;
import com.staybook.reservation.domain.service.ReservationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Expires pending reservations whose hold has elapsed, and payment attempts whose checkout
 * session has lapsed.
 *
 * Safe to run on every instance at once: each reservation is expired in its own transaction
 * by a conditional update, so two reapers racing on the same row do the work once.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HoldReaper {

    private final ReservationRepository reservationRepository;
    private final ReservationManager reservationManager;
    private final PaymentOrchestrator paymentOrchestrator;
    private final Clock clock;

    @Value("${stay.reaper.enabled:true}")
    private boolean reaperEnabled;

    @Value("${stay.reaper.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${stay.reaper.interval-ms:60000}")
    public void reap() {
        if (!reaperEnabled) return;
        int expired = expireStaleHolds();
        int lapsed = expireLapsedAttempts();
        if (expired > 0 || lapsed > 0) {
            log.info("Hold reaper: {} reservation(s) expired, {} payment attempt(s) lapsed", expired, lapsed);
        }
    }

    int expireStaleHolds() {
        List<String> stale = reservationRepository.findExpiredHoldIds(
                LocalDateTime.now(clock), PageRequest.of(0, batchSize));
        int expired = 0;
        for (String reservationId : stale) {
            try {
                if (reservationManager.expireHold(reservationId)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Hold reaper failed to expire reservation {}", reservationId, e);
            }
        }
        return expired;
    }

    int expireLapsedAttempts() {
        List<PaymentAttempt> lapsed = paymentOrchestrator.findLapsedAttempts();
        int count = 0;
        for (PaymentAttempt attempt : lapsed) {
            try {
                if (paymentOrchestrator.expireLapsedAttempt(attempt.getId())) {
                    count++;
                }
            } catch (Exception e) {
                log.error("Hold reaper failed to expire payment attempt {}", attempt.getId(), e);
            }
        }
        return count;
    }
}
