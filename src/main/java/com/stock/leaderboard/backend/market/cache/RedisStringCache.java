package com.stock.leaderboard.backend.market.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class RedisStringCache {

    private final StringRedisTemplate redis;

    // 고정 윈도우 카운터: 첫 증가 때만 만료 설정
    public Long increment(String key, Duration ttl) {
        Long value = redis.opsForValue().increment(key);
        if (value != null && value == 1L) {
            redis.expire(key, ttl);
        }
        return value;
    }
}
