package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.leaderboard.dto.LeaderboardPage;
import com.stock.leaderboard.backend.market.cache.CacheStats;
import com.stock.leaderboard.backend.market.cache.SweepableCache;
import com.stock.leaderboard.backend.market.cache.TtlCache;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * 계산이 끝난 리더보드 페이지를 짧게(기본 30초) 들고 있는다.
 */
@Component
public class LeaderboardPageCache implements SweepableCache {

    private final TtlCache<LeaderboardPage> pages;
    private final LeaderboardProperties properties;

    public LeaderboardPageCache(Clock clock, LeaderboardProperties properties) {
        this.properties = properties;
        this.pages = new TtlCache<>("leaderboard", clock, properties.getCacheMaxPages());
    }

    public Optional<LeaderboardPage> get(LeaderboardQuery query) {
        return pages.get(query.cacheKey());
    }

    public void put(LeaderboardQuery query, LeaderboardPage page) {
        pages.put(query.cacheKey(), page, properties.getCacheTtl());
    }

    public void clear() {
        pages.clear();
    }

    public CacheStats stats() {
        return pages.stats();
    }

    @Override
    public String cacheName() {
        return pages.cacheName();
    }

    @Override
    public int evictExpired() {
        return pages.evictExpired();
    }
}
