package com.stock.leaderboard.backend.market.cache;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 등록된 캐시들의 만료 엔트리를 주기적으로 비운다.
 * 애플리케이션 컨텍스트와 수명을 같이 하고, 종료 시 예약 작업을 취소한다.
 */
@Slf4j
@Component
public class CacheSweeper {

    private final List<SweepableCache> caches;
    private final TaskScheduler taskScheduler;
    private final Duration interval;

    private ScheduledFuture<?> task;

    public CacheSweeper(
            List<SweepableCache> caches,
            @Qualifier("cacheSweepScheduler") TaskScheduler taskScheduler,
            QuoteCacheProperties properties
    ) {
        this.caches = caches;
        this.taskScheduler = taskScheduler;
        this.interval = properties.getSweepInterval();
    }

    @PostConstruct
    public synchronized void start() {
        if (task != null) return;
        task = taskScheduler.scheduleWithFixedDelay(this::sweep, interval);
        log.info("cache sweeper started. caches={}, interval={}", caches.size(), interval);
    }

    @PreDestroy
    public synchronized void stop() {
        if (task == null) return;
        task.cancel(false);
        task = null;
        log.info("cache sweeper stopped.");
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    public int sweep() {
        int total = 0;
        for (SweepableCache cache : caches) {
            try {
                int removed = cache.evictExpired();
                total += removed;
                if (removed > 0) {
                    log.debug("cache sweep. cache={}, removed={}", cache.cacheName(), removed);
                }
            } catch (RuntimeException e) {
                // 한 캐시가 실패해도 나머지는 계속 정리
                log.warn("cache sweep failed. cache={}", cache.cacheName(), e);
            }
        }
        log.info("cache sweep done. evicted={}", total);
        return total;
    }
}
