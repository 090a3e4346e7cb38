package com.staybook.reservation.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.staybook.common.exception.ServiceUnavailableException;
import com.staybook.common.util.Constants;
import com.staybook.reservation.domain.model.IdempotencyRecord;
import com.staybook.reservation.domain.model.IdempotencyRecord.RecordType;
import com.staybook.reservation.domain.repository.IdempotencyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Exactly-once gate for gateway events and client commands.
 *
 * The database row is the source of truth. A key is claimed with an insert-if-absent
 * inside the caller's transaction, so the claim commits or rolls back together with the
 * effect it guards. Command responses are additionally cached in Redis when enabled, once
 * the claim has committed: reads try Redis first and fall back to the database on a miss or error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyGuard {

    private static final String IDEMPOTENCY_UNAVAILABLE_MSG =
            "Idempotency check temporarily unavailable. Retry with same key later.";
    static final String COMMAND_IN_PROGRESS_MSG =
            "A request with this idempotency key is still being processed. Retry shortly.";

    private final IdempotencyRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired(required = false)
    private StringRedisTemplate stringRedisTemplate;

    @Value("${stay.idempotency.redis-cache:true}")
    private boolean redisCacheEnabled;

    @Value("${stay.idempotency.redis-ttl-hours:24}")
    private long redisTtlHours;

    /**
     * Claims {@code key}. Blocks while another transaction holds an uncommitted claim on the same key.
     *
     * @return true if this caller is the first to see the key
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean recordIfNew(String key, RecordType type, String reservationId) {
        try {
            return repository.insertIfAbsent(key, type.name(), reservationId, LocalDateTime.now(clock)) == 1;
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", key, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<IdempotencyRecord> find(String key) {
        return repository.findById(key);
    }

    /**
     * Stores the outcome of a claimed key. {@code response} may be null for events.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void complete(String key, String reservationId, String outcome, String resultingStatus, Object response) {
        IdempotencyRecord record = repository.findById(key)
                .orElseThrow(() -> new IllegalStateException("Idempotency key was never claimed: " + key));
        record.setReservationId(reservationId);
        record.setOutcome(outcome);
        record.setResultingReservationStatus(resultingStatus);
        if (response != null) {
            record.setResponseJson(toJson(key, response));
        }
        repository.save(record);
    }

    /**
     * Runs {@code command} once per key. A retry with a completed key gets the stored response
     * back; a retry racing an unfinished first request is told to come back later.
     * Must run inside the caller's transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public <T> T executeOnce(String key, Class<T> responseType, Supplier<T> command,
                             Function<T, String> reservationIdOf, Function<T, String> statusOf) {
        Optional<T> cached = getCachedResponse(key, responseType);
        if (cached.isPresent()) {
            log.info("Replaying stored response for idempotency key: {}", key);
            return cached.get();
        }
        if (!recordIfNew(key, RecordType.COMMAND, null)) {
            return getCachedResponse(key, responseType)
                    .orElseThrow(() -> new ServiceUnavailableException(COMMAND_IN_PROGRESS_MSG));
        }

        T response = command.get();
        complete(key, reservationIdOf.apply(response), "APPLIED", statusOf.apply(response), response);
        warmRedisCacheAfterCommit(key, response);
        return response;
    }

    /**
     * Read: Redis first (fast) if enabled; on miss or error fall back to DB (source of truth).
     */
    <T> Optional<T> getCachedResponse(String key, Class<T> responseType) {
        if (redisCacheEnabled && stringRedisTemplate != null) {
            try {
                String json = stringRedisTemplate.opsForValue().get(Constants.IDEMPOTENCY_CACHE_PREFIX + key);
                if (json != null) {
                    log.debug("Idempotency hit from Redis for key: {}", key);
                    return Optional.of(objectMapper.readValue(json, responseType));
                }
            } catch (Exception e) {
                log.debug("Redis idempotency read missed or failed, falling back to DB: {}", e.getMessage());
            }
        }
        return getCachedResponseFromDb(key, responseType);
    }

    private <T> Optional<T> getCachedResponseFromDb(String key, Class<T> responseType) {
        try {
            return repository.findById(key)
                    .filter(row -> row.getResponseJson() != null)
                    .map(row -> {
                        try {
                            return objectMapper.readValue(row.getResponseJson(), responseType);
                        } catch (JsonProcessingException e) {
                            log.warn("Failed to deserialize stored response for key: {}", key, e);
                            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
                        }
                    });
        } catch (DataAccessException e) {
            log.warn("Idempotency store (DB) unavailable for key: {}", key, e);
            throw new ServiceUnavailableException(IDEMPOTENCY_UNAVAILABLE_MSG, e);
        }
    }

    /**
     * Redis must never hold a response whose database row rolled back, so the write waits
     * for the surrounding commit.
     */
    private void warmRedisCacheAfterCommit(String key, Object response) {
        if (!redisCacheEnabled || stringRedisTemplate == null) return;
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            warmRedisCache(key, response);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                warmRedisCache(key, response);
            }
        });
    }

    /**
     * Best-effort: failure only costs a later DB read.
     */
    private void warmRedisCache(String key, Object response) {
        if (!redisCacheEnabled || stringRedisTemplate == null) return;
        try {
            stringRedisTemplate.opsForValue().set(
                    Constants.IDEMPOTENCY_CACHE_PREFIX + key, objectMapper.writeValueAsString(response),
                    Duration.ofHours(redisTtlHours));
            log.debug("Warmed Redis idempotency cache for key: {}", key);
        } catch (Exception e) {
            log.warn("Failed to warm Redis idempotency cache for key: {} (non-fatal)", key, e);
        }
    }

    private String toJson(String key, Object response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize response for idempotency key: {}", key, e);
            throw new IllegalStateException("Idempotency save failed", e);
        }
    }
}
