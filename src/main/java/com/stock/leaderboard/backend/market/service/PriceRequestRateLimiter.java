package com.stock.leaderboard.backend.market.service;

import com.stock.leaderboard.backend.exception.RateLimitExceededException;
import com.stock.leaderboard.backend.market.cache.RedisStringCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 클라이언트별 고정 윈도우 요청 제한 (Redis 카운터).
 * Redis 가 죽어 있으면 요청을 막지 않고 통과시킨다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceRequestRateLimiter {

    private static final String KEY_PREFIX = "ratelimit:prices:";

    private final RedisStringCache redisStringCache;
    private final PriceQueryProperties properties;
    private final Clock clock;

    public void acquire(String clientKey) {
        PriceQueryProperties.RateLimit limit = properties.getRateLimit();
        if (!limit.isEnabled()) return;

        long windowSeconds = Math.max(1, limit.getWindow().getSeconds());
        long nowSeconds = clock.instant().getEpochSecond();
        long windowIndex = nowSeconds / windowSeconds;
        String key = KEY_PREFIX + (clientKey == null ? "unknown" : clientKey) + ":" + windowIndex;

        Long count;
        try {
            count = redisStringCache.increment(key, limit.getWindow());
        } catch (RuntimeException e) {
            log.warn("rate limiter unavailable, allowing request. client={}, reason={}", clientKey, e.getMessage());
            return;
        }

        if (count != null && count > limit.getMaxRequests()) {
            long retryAfter = windowSeconds - (nowSeconds % windowSeconds);
            throw new RateLimitExceededException(
                    "요청이 너무 많습니다. " + retryAfter + "초 후 다시 시도해주세요.",
                    retryAfter
            );
        }
    }
}
