package com.staybook.reservation.job;

import com.staybook.reservation.domain.model.Reservation.ReservationStatus;
import com.staybook.reservation.domain.repository.ReservationRepository;
import com.staybook.reservation.domain.service.ReservationManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Marks confirmed reservations completed once their check-out date has arrived.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StayCompletionJob {

    private final ReservationRepository reservationRepository;
    private final ReservationManager reservationManager;
    private final Clock clock;

    @Value("${stay.completion.batch-size:200}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${stay.completion.interval-ms:3600000}")
    public void completeFinishedStays() {
        List<String> due = reservationRepository.findIdsCheckingOutBy(
                LocalDate.now(clock), ReservationStatus.CONFIRMED, PageRequest.of(0, batchSize));
        if (due.isEmpty()) return;
        int completed = 0;
        for (String reservationId : due) {
            try {
                if (reservationManager.completeStay(reservationId)) {
                    completed++;
                }
            } catch (Exception e) {
                log.error("Stay completion failed for reservation {}", reservationId, e);
            }
        }
        log.info("Stay completion: {} of {} reservation(s) completed", completed, due.size());
    }
}
