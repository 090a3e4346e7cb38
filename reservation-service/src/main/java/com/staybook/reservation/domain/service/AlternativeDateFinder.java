package com.staybook.reservation.domain.service;

import com.staybook.reservation.domain.model.DateCell;
import com.staybook.reservation.domain.model.DateRange;
import com.staybook.reservation.domain.repository.DateCellRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds free ranges of the same length near a rejected request.
 *
 * Candidates start 1, 2, ... days before and after the requested check-in (earlier first
 * on a tie) up to the search window. A candidate qualifies when none of its nights is
 * booked or under a live hold and it does not start in the past. Results are therefore
 * ordered by distance from the request.
 */
@Component
@RequiredArgsConstructor
public class AlternativeDateFinder {

    private final DateCellRepository repository;

    @Value("${stay.ledger.alternatives.search-window-days:14}")
    private int searchWindowDays;

    public List<DateRange> findAlternatives(DateRange requested, LocalDateTime now, int maxResults) {
        if (maxResults <= 0) {
            return List.of();
        }
        LocalDate today = now.toLocalDate();
        int nights = requested.nights();
        Set<LocalDate> blocked = repository.findRange(
                        requested.checkIn().minusDays(searchWindowDays),
                        requested.checkOut().plusDays(searchWindowDays))
                .stream()
                .filter(cell -> cell.isBlocking(now))
                .map(DateCell::getCellDate)
                .collect(Collectors.toSet());

        List<DateRange> alternatives = new ArrayList<>(maxResults);
        for (int offset = 1; offset <= searchWindowDays && alternatives.size() < maxResults; offset++) {
            for (int direction : new int[]{-1, 1}) {
                LocalDate start = requested.checkIn().plusDays((long) direction * offset);
                if (start.isBefore(today) || alternatives.size() >= maxResults) {
                    continue;
                }
                DateRange candidate = DateRange.ofNights(start, nights);
                if (candidate.dates().stream().noneMatch(blocked::contains)) {
                    alternatives.add(candidate);
                }
            }
        }
        return alternatives;
    }
}
