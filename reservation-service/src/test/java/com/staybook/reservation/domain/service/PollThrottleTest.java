package com.staybook.reservation.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PollThrottleTest {

    @Mock
    private RedissonClient redissonClient;
    @Mock
    private RBucket<Object> bucket;

    @InjectMocks
    private PollThrottle throttle;

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(throttle, "minIntervalMs", 2000L);
        when(redissonClient.getBucket("throttle:poll:RES-1")).thenReturn(bucket);
    }

    @Test
    @DisplayName("tryAcquire: one pull per interval, the next caller inside the interval is throttled")
    void tryAcquire_onePerInterval() {
        when(bucket.setIfAbsent("1", Duration.ofMillis(2000))).thenReturn(true, false);

        assertThat(throttle.tryAcquire("RES-1")).isTrue();
        assertThat(throttle.tryAcquire("RES-1")).isFalse();
    }

    @Test
    @DisplayName("tryAcquire: Redis unreachable, pull allowed")
    void tryAcquire_redisDown_failsOpen() {
        when(bucket.setIfAbsent("1", Duration.ofMillis(2000))).thenThrow(new RedisConnectionException("down"));

        assertThat(throttle.tryAcquire("RES-1")).isTrue();
    }
}
