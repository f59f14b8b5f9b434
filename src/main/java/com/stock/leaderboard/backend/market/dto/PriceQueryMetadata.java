package com.stock.leaderboard.backend.market.dto;

import com.stock.leaderboard.backend.market.cache.CacheStats;
import com.stock.leaderboard.backend.market.cache.CoalescerStats;

import java.time.Instant;
import java.util.List;

public record PriceQueryMetadata(
        int requested,
        int returned,
        List<CacheStats> cacheStats,
        CoalescerStats coalescerStats,
        Instant asOf
) {}
