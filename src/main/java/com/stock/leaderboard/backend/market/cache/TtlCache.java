package com.stock.leaderboard.backend.market.cache;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 키별 TTL 을 갖는 인메모리 캐시.
 * <p>
 * 만료 여부는 읽을 때마다 주입된 {@link Clock} 으로 판단하므로, 주기적 sweep 이 돌기 전이라도
 * 만료된 값이 반환되는 일은 없다. 엔트리 수가 {@code maxEntries} 에 닿으면 만료분부터 비우고,
 * 그래도 꽉 차 있으면 가장 오래 저장된 엔트리를 내보낸다.
 */
@Slf4j
public class TtlCache<V> implements SweepableCache {

    private final String name;
    private final Clock clock;
    private final int maxEntries;

    private final Map<String, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public TtlCache(String name, Clock clock, int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries는 1 이상이어야 합니다. name=" + name);
        }
        this.name = name;
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public Optional<V> get(String key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        if (entry.isExpired(clock.instant())) {
            // lazy 만료: 다른 스레드가 방금 갱신한 값은 지우지 않는다
            entries.remove(key, entry);
            misses.incrementAndGet();
            return Optional.empty();
        }

        hits.incrementAndGet();
        return Optional.of(entry.value());
    }

    public void put(String key, V value, Duration ttl) {
        if (value == null) return;
        if (ttl == null || ttl.isNegative() || ttl.isZero()) return;

        if (entries.size() >= maxEntries && !entries.containsKey(key)) {
            makeRoom();
        }
        entries.put(key, new CacheEntry<>(value, clock.instant(), ttl));
    }

    public void invalidate(String key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    @Override
    public String cacheName() {
        return name;
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    public CacheStats stats() {
        String oldest = null;
        String newest = null;
        Instant oldestAt = null;
        Instant newestAt = null;

        for (Map.Entry<String, CacheEntry<V>> e : entries.entrySet()) {
            Instant at = e.getValue().storedAt();
            if (oldestAt == null || at.isBefore(oldestAt)) {
                oldestAt = at;
                oldest = e.getKey();
            }
            if (newestAt == null || at.isAfter(newestAt)) {
                newestAt = at;
                newest = e.getKey();
            }
        }

        return new CacheStats(name, entries.size(), hits.get(), misses.get(), oldest, newest);
    }

    private void makeRoom() {
        int expired = evictExpired();
        if (entries.size() < maxEntries) return;

        entries.entrySet().stream()
                .min(Comparator.comparing(e -> e.getValue().storedAt()))
                .ifPresent(e -> {
                    entries.remove(e.getKey(), e.getValue());
                    log.debug("cache full, evicted oldest. cache={}, key={}, expiredRemoved={}",
                            name, e.getKey(), expired);
                });
    }
}
