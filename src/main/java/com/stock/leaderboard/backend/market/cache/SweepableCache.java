package com.stock.leaderboard.backend.market.cache;

/**
 * {@link CacheSweeper} 가 주기적으로 만료 엔트리를 비우는 대상.
 */
public interface SweepableCache {

    String cacheName();

    int evictExpired();
}
