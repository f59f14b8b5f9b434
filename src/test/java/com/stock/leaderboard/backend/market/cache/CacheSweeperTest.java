package com.stock.leaderboard.backend.market.cache;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CacheSweeperTest {

    @Mock TaskScheduler taskScheduler;
    @Mock ScheduledFuture<Object> future;
    @Mock SweepableCache first;
    @Mock SweepableCache second;

    @Test
    void start_schedules_with_configured_interval_and_stop_cancels() {
        QuoteCacheProperties props = new QuoteCacheProperties();
        props.setSweepInterval(Duration.ofMinutes(10));
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(10)));

        CacheSweeper sweeper = new CacheSweeper(List.of(first), taskScheduler, props);
        sweeper.start();
        sweeper.start();   // 두 번 호출해도 한 번만 예약

        assertTrue(sweeper.isRunning());
        verify(taskScheduler, times(1)).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(10)));

        sweeper.stop();
        verify(future).cancel(false);
        assertFalse(sweeper.isRunning());
    }

    @Test
    void sweep_continues_when_one_cache_fails() {
        when(first.evictExpired()).thenThrow(new IllegalStateException("boom"));
        when(first.cacheName()).thenReturn("broken");
        when(second.evictExpired()).thenReturn(4);
        when(second.cacheName()).thenReturn("leaderboard");

        CacheSweeper sweeper = new CacheSweeper(List.of(first, second), taskScheduler, new QuoteCacheProperties());

        assertEquals(4, sweeper.sweep());
        verify(second).evictExpired();
    }
}
