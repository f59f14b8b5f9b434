package com.stock.leaderboard.backend.market.cache;

public record CacheStats(
        String name,
        int entries,
        long hits,
        long misses,
        String oldestKey,   // 비어 있으면 null
        String newestKey
) {}
