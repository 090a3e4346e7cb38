package com.staybook.reservation.domain.repository;

import com.staybook.reservation.domain.model.DateCell;
import com.staybook.reservation.domain.model.DateCell.CellStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test for the conditional writes of {@link DateCellRepository}.
 *
 * Uses @DataJpaTest so only the JPA layer is loaded (no Redis, Kafka or Feign).
 * Testcontainers provides a real PostgreSQL instance for the native ON CONFLICT insert.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@EntityScan("com.staybook.reservation.domain.model")
@Testcontainers(disabledWithoutDocker = true)
class DateCellRepositoryIntegrationTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 10, 0);
    private static final LocalDateTime HOLD_UNTIL = NOW.plusMinutes(30);
    private static final LocalDate NIGHT = LocalDate.of(2026, 3, 21);

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("reservation_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.flyway.enabled", () -> "false");
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
    }

    @Autowired
    private DateCellRepository repository;

    @Test
    @DisplayName("insertIfAbsent + acquire: first holder wins, second gets 0 rows")
    void acquire_freeCell_singleWinner() {
        assertThat(repository.insertIfAbsent(NIGHT, NOW)).isEqualTo(1);
        assertThat(repository.insertIfAbsent(NIGHT, NOW)).isZero();

        assertThat(repository.acquire(NIGHT, "RES-A", HOLD_UNTIL, NOW)).isEqualTo(1);
        assertThat(repository.acquire(NIGHT, "RES-B", HOLD_UNTIL, NOW)).isZero();

        DateCell cell = repository.findById(NIGHT).orElseThrow();
        assertThat(cell.getStatus()).isEqualTo(CellStatus.HELD);
        assertThat(cell.getHolderReservationId()).isEqualTo("RES-A");
    }

    @Test
    @DisplayName("acquire: an elapsed hold is taken over without any cleanup")
    void acquire_expiredHold_takenOver() {
        repository.saveAndFlush(DateCell.builder()
                .cellDate(NIGHT)
                .status(CellStatus.HELD)
                .holderReservationId("RES-A")
                .holdExpiresAt(NOW.minusMinutes(1))
                .updatedAt(NOW.minusMinutes(31))
                .build());

        assertThat(repository.acquire(NIGHT, "RES-B", HOLD_UNTIL, NOW)).isEqualTo(1);

        DateCell cell = repository.findById(NIGHT).orElseThrow();
        assertThat(cell.getHolderReservationId()).isEqualTo("RES-B");
        assertThat(cell.getHoldExpiresAt()).isEqualTo(HOLD_UNTIL);
    }

    @Test
    @DisplayName("acquire: booked cells never change hands")
    void acquire_bookedCell_refused() {
        repository.saveAndFlush(DateCell.builder()
                .cellDate(NIGHT)
                .status(CellStatus.BOOKED)
                .holderReservationId("RES-A")
                .updatedAt(NOW)
                .build());

        assertThat(repository.acquire(NIGHT, "RES-B", HOLD_UNTIL, NOW.plusDays(30))).isZero();
    }

    @Test
    @DisplayName("confirmCells / releaseCells: only the holder's cells are touched")
    void confirmAndRelease_onlyHolder() {
        List<LocalDate> nights = List.of(NIGHT, NIGHT.plusDays(1));
        nights.forEach(night -> {
            repository.insertIfAbsent(night, NOW);
            repository.acquire(night, "RES-A", HOLD_UNTIL, NOW);
        });

        assertThat(repository.confirmCells(nights, "RES-B", NOW)).isZero();
        assertThat(repository.releaseCells(nights, "RES-B", NOW)).isZero();
        assertThat(repository.countHeldBy(nights, "RES-A", CellStatus.HELD)).isEqualTo(2);

        assertThat(repository.confirmCells(nights, "RES-A", NOW)).isEqualTo(2);
        assertThat(repository.countHeldBy(nights, "RES-A", CellStatus.BOOKED)).isEqualTo(2);
        assertThat(repository.findById(NIGHT).orElseThrow().getHoldExpiresAt()).isNull();

        assertThat(repository.releaseCells(nights, "RES-A", NOW)).isEqualTo(2);
        assertThat(repository.findById(NIGHT).orElseThrow().getStatus()).isEqualTo(CellStatus.FREE);
    }

    @Test
    @DisplayName("findBlockingDates: own holds, elapsed holds and untouched dates do not block")
    void findBlockingDates_filtersOwnAndElapsed() {
        LocalDate own = NIGHT;
        LocalDate elapsed = NIGHT.plusDays(1);
        LocalDate booked = NIGHT.plusDays(2);
        LocalDate untouched = NIGHT.plusDays(3);
        repository.saveAndFlush(held(own, "RES-A", HOLD_UNTIL));
        repository.saveAndFlush(held(elapsed, "RES-B", NOW.minusSeconds(1)));
        repository.saveAndFlush(DateCell.builder().cellDate(booked).status(CellStatus.BOOKED)
                .holderReservationId("RES-C").updatedAt(NOW).build());

        List<LocalDate> blocking = repository.findBlockingDates(List.of(own, elapsed, booked, untouched), "RES-A", NOW);

        assertThat(blocking).containsExactly(booked);
    }

    @Test
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    @DisplayName("acquire under contention: exactly one of many concurrent writers holds the night")
    void acquire_concurrentWriters_exactlyOneWins() throws Exception {
        LocalDate night = LocalDate.of(2026, 4, 10);
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String holder = "RES-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    repository.insertIfAbsent(night, NOW);
                    return repository.acquire(night, holder, HOLD_UNTIL, NOW);
                }));
            }
            start.countDown();

            int winners = 0;
            for (Future<Integer> result : results) {
                winners += result.get(30, TimeUnit.SECONDS);
            }

            assertThat(winners).isEqualTo(1);
            assertThat(repository.findById(night).orElseThrow().getStatus()).isEqualTo(CellStatus.HELD);
        } finally {
            pool.shutdownNow();
            repository.deleteAll();
        }
    }

    private static DateCell held(LocalDate date, String holder, LocalDateTime expiresAt) {
        return DateCell.builder()
                .cellDate(date)
                .status(CellStatus.HELD)
                .holderReservationId(holder)
                .holdExpiresAt(expiresAt)
                .updatedAt(NOW)
                .build();
    }
}
