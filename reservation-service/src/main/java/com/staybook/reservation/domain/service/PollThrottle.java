package com.staybook.reservation.domain.service;

import com.staybook.common.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Cross-instance minimum interval between gateway status pulls for one reservation.
 *
 * A Redis key with a TTL equal to the interval marks the last pull; {@code setIfAbsent}
 * lets exactly one caller per interval through. When Redis cannot be reached the pull is
 * allowed: polling is advisory and the gateway call is itself idempotent.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PollThrottle {

    private final RedissonClient redissonClient;

    @Value("${stay.polling.min-interval-ms:2000}")
    private long minIntervalMs;

    /**
     * @return true if the caller may pull now
     */
    public boolean tryAcquire(String reservationId) {
        try {
            RBucket<String> bucket = redissonClient.getBucket(Constants.POLL_THROTTLE_PREFIX + reservationId);
            boolean acquired = bucket.setIfAbsent("1", Duration.ofMillis(minIntervalMs));
            if (!acquired) {
                log.warn("Status poll for {} throttled (min interval {} ms)", reservationId, minIntervalMs);
            }
            return acquired;
        } catch (RuntimeException e) {
            log.warn("Poll throttle unavailable for {}, allowing pull: {}", reservationId, e.getMessage());
            return true;
        }
    }
}
