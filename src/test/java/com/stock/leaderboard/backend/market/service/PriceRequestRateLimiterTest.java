package com.stock.leaderboard.backend.market.service;

import com.stock.leaderboard.backend.exception.RateLimitExceededException;
import com.stock.leaderboard.backend.market.cache.RedisStringCache;
import com.stock.leaderboard.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PriceRequestRateLimiterTest {

    @Mock RedisStringCache redisStringCache;

    PriceQueryProperties props;
    MutableClock clock;
    PriceRequestRateLimiter limiter;

    @BeforeEach
    void setUp() {
        props = new PriceQueryProperties();
        props.getRateLimit().setMaxRequests(100);
        props.getRateLimit().setWindow(Duration.ofMinutes(15));
        // 윈도우 시작 후 5분 지난 시점
        clock = new MutableClock(Instant.ofEpochSecond(900L * 2_000_000 + 300));
        limiter = new PriceRequestRateLimiter(redisStringCache, props, clock);
    }

    @Test
    void request_within_limit_passes() {
        when(redisStringCache.increment(anyString(), eq(Duration.ofMinutes(15)))).thenReturn(100L);

        assertDoesNotThrow(() -> limiter.acquire("10.0.0.1"));
        verify(redisStringCache).increment("ratelimit:prices:10.0.0.1:2000000", Duration.ofMinutes(15));
    }

    @Test
    void request_over_limit_is_rejected_with_seconds_left_in_window() {
        when(redisStringCache.increment(anyString(), eq(Duration.ofMinutes(15)))).thenReturn(101L);

        RateLimitExceededException ex = assertThrows(RateLimitExceededException.class,
                () -> limiter.acquire("10.0.0.1"));

        assertEquals(600, ex.getRetryAfterSeconds());
    }

    @Test
    void redis_outage_fails_open() {
        when(redisStringCache.increment(anyString(), eq(Duration.ofMinutes(15))))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertDoesNotThrow(() -> limiter.acquire("10.0.0.1"));
    }

    @Test
    void disabled_limiter_does_not_touch_redis() {
        props.getRateLimit().setEnabled(false);

        limiter.acquire("10.0.0.1");

        verifyNoInteractions(redisStringCache);
    }
}
