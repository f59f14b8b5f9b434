package com.stock.leaderboard.backend.market.scheduler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class BatchFetchSchedulerTest {

    // 같은 스레드에서 바로 실행 → 호출 순서가 결정적
    Executor direct = Runnable::run;

    BatchFetchProperties props;
    List<Duration> sleeps;
    List<String> calls;

    @BeforeEach
    void setUp() {
        props = new BatchFetchProperties();
        props.setGroupSize(2);
        props.setInterGroupDelay(Duration.ofMillis(500));
        sleeps = new ArrayList<>();
        calls = new ArrayList<>();
    }

    @Test
    void duplicate_symbols_are_fetched_once() {
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, sleeps::add);

        Map<String, String> result = scheduler.fetchAll(List.of("AAPL", "AAPL", "MSFT"), s -> {
            calls.add(s);
            return s.toLowerCase();
        });

        assertEquals(2, result.size());
        assertEquals(List.of("AAPL", "MSFT"), calls);
        assertEquals("aapl", result.get("AAPL"));
    }

    @Test
    void groups_are_separated_by_configured_delay() {
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, sleeps::add);

        Map<String, Integer> result = scheduler.fetchAll(
                List.of("A", "B", "C", "D", "E"),
                s -> {
                    calls.add(s);
                    return s.length();
                });

        // 5개 / 그룹 2 → 3그룹 → 대기 2번
        assertEquals(5, result.size());
        assertEquals(List.of(Duration.ofMillis(500), Duration.ofMillis(500)), sleeps);
        assertEquals(List.of("A", "B", "C", "D", "E"), new ArrayList<>(result.keySet()));
    }

    @Test
    void single_group_does_not_wait() {
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, sleeps::add);

        scheduler.fetchAll(List.of("A", "B"), s -> s);

        assertTrue(sleeps.isEmpty());
    }

    @Test
    void failing_item_uses_fallback_or_is_omitted() {
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, sleeps::add);

        Map<String, String> withFallback = scheduler.fetchAll(
                List.of("OK", "BAD"),
                s -> {
                    if (s.equals("BAD")) throw new IllegalStateException("down");
                    return "live";
                },
                s -> "fallback",
                new CancellationToken());

        assertEquals("live", withFallback.get("OK"));
        assertEquals("fallback", withFallback.get("BAD"));

        Map<String, String> withoutFallback = scheduler.fetchAll(
                List.of("OK", "BAD", "ALSO_OK"),
                s -> {
                    if (s.equals("BAD")) throw new IllegalStateException("down");
                    return "live";
                });

        assertEquals(2, withoutFallback.size());
        assertFalse(withoutFallback.containsKey("BAD"));
    }

    @Test
    void cancelling_during_delay_aborts_without_partial_result() {
        CancellationToken token = new CancellationToken();
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, d -> token.cancel());

        assertThrows(CancellationException.class, () -> scheduler.fetchAll(
                List.of("A", "B", "C"),
                s -> {
                    calls.add(s);
                    return s;
                },
                null,
                token));

        // 두 번째 그룹은 시작하지 않는다
        assertEquals(List.of("A", "B"), calls);
    }

    @Test
    void interrupted_sleep_is_treated_as_cancellation() {
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, d -> {
            throw new InterruptedException();
        });

        try {
            assertThrows(CancellationException.class,
                    () -> scheduler.fetchAll(List.of("A", "B", "C"), s -> s));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();   // 다음 테스트에 인터럽트 플래그를 넘기지 않는다
        }
    }

    @Test
    void already_cancelled_token_fetches_nothing() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        BatchFetchScheduler scheduler = new BatchFetchScheduler(props, direct, sleeps::add);

        assertThrows(CancellationException.class,
                () -> scheduler.fetchAll(List.of("A"), s -> {
                    calls.add(s);
                    return s;
                }, null, token));
        assertTrue(calls.isEmpty());
    }

    @Test
    void partition_splits_into_fixed_size_chunks() {
        List<List<Integer>> parts = BatchFetchScheduler.partition(List.of(1, 2, 3, 4, 5), 2);

        assertEquals(List.of(List.of(1, 2), List.of(3, 4), List.of(5)), parts);
    }
}
