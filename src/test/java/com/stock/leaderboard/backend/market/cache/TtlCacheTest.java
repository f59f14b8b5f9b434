package com.stock.leaderboard.backend.market.cache;

import com.stock.leaderboard.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TtlCacheTest {

    MutableClock clock;
    TtlCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-07-30T14:00:00Z"));
        cache = new TtlCache<>("test", clock, 3);
    }

    @Test
    void entry_is_served_until_just_before_ttl() {
        cache.put("k", "v", Duration.ofMinutes(15));

        clock.advance(Duration.ofMinutes(15).minusMillis(1));

        assertEquals("v", cache.get("k").orElse(null));
    }

    @Test
    void entry_is_gone_at_and_after_ttl_even_without_sweep() {
        cache.put("k", "v", Duration.ofMinutes(15));

        clock.advance(Duration.ofMinutes(15));
        assertTrue(cache.get("k").isEmpty());

        // lazy 만료로 이미 지워짐
        assertEquals(0, cache.size());
    }

    @Test
    void null_value_and_non_positive_ttl_are_not_stored() {
        cache.put("a", null, Duration.ofMinutes(1));
        cache.put("b", "v", Duration.ZERO);
        cache.put("c", "v", Duration.ofSeconds(-1));

        assertEquals(0, cache.size());
    }

    @Test
    void full_cache_evicts_expired_first_then_oldest() {
        cache.put("short", "1", Duration.ofSeconds(1));
        clock.advance(Duration.ofMillis(10));
        cache.put("old", "2", Duration.ofHours(1));
        clock.advance(Duration.ofMillis(10));
        cache.put("mid", "3", Duration.ofHours(1));

        clock.advance(Duration.ofSeconds(2));
        cache.put("new1", "4", Duration.ofHours(1));   // 만료된 short 가 빠진다

        assertTrue(cache.get("old").isPresent());
        assertTrue(cache.get("short").isEmpty());

        cache.put("new2", "5", Duration.ofHours(1));   // 만료분이 없으니 가장 오래된 old 가 빠진다

        assertTrue(cache.get("old").isEmpty());
        assertTrue(cache.get("mid").isPresent());
        assertTrue(cache.get("new2").isPresent());
        assertEquals(3, cache.size());
    }

    @Test
    void evict_expired_removes_only_expired_entries() {
        cache.put("a", "1", Duration.ofSeconds(5));
        cache.put("b", "2", Duration.ofMinutes(5));

        clock.advance(Duration.ofSeconds(6));

        assertEquals(1, cache.evictExpired());
        assertEquals(1, cache.size());
    }

    @Test
    void stats_count_hits_misses_and_track_oldest_newest_key() {
        cache.put("first", "1", Duration.ofMinutes(1));
        clock.advance(Duration.ofSeconds(1));
        cache.put("second", "2", Duration.ofMinutes(1));

        cache.get("first");
        cache.get("first");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertEquals("test", stats.name());
        assertEquals(2, stats.entries());
        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals("first", stats.oldestKey());
        assertEquals("second", stats.newestKey());
    }
}
