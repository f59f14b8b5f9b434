package com.stock.leaderboard.backend.market.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * 저장 시각 + TTL. now < storedAt + ttl 일 때만 유효.
 */
public record CacheEntry<V>(
        V value,
        Instant storedAt,
        Duration ttl
) {
    public Instant expiresAt() {
        return storedAt.plus(ttl);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
