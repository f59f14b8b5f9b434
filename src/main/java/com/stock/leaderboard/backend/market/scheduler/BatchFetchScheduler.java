package com.stock.leaderboard.backend.market.scheduler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * 심볼 목록을 작은 그룹으로 나눠 그룹 안에서는 동시에, 그룹 사이에는 지연을 두고 조회한다.
 * <p>
 * 중복 심볼은 한 번만 조회한다. 한 항목이 실패해도 배치는 계속되고, fetcher 와 fallback 이 모두
 * 실패한 항목만 결과에서 빠진다. 결과 맵은 배치가 끝난 뒤에만 돌려준다.
 */
@Slf4j
@Component
public class BatchFetchScheduler {

    private final BatchFetchProperties properties;
    private final Executor executor;
    private final Sleeper sleeper;

    @Autowired
    public BatchFetchScheduler(
            BatchFetchProperties properties,
            @Qualifier("marketDataExecutor") Executor executor
    ) {
        this(properties, executor, Sleeper.THREAD_SLEEP);
    }

    public BatchFetchScheduler(BatchFetchProperties properties, Executor executor, Sleeper sleeper) {
        this.properties = properties;
        this.executor = executor;
        this.sleeper = sleeper;
    }

    public <T> Map<String, T> fetchAll(Collection<String> symbols, Function<String, T> fetcher) {
        return fetchAll(symbols, fetcher, null, new CancellationToken());
    }

    /**
     * @param fallback fetcher 가 실패했을 때 쓸 값 (null 이면 없음)
     * @throws CancellationException token 이 취소된 경우. 부분 결과는 돌려주지 않는다.
     */
    public <T> Map<String, T> fetchAll(
            Collection<String> symbols,
            Function<String, T> fetcher,
            Function<String, T> fallback,
            CancellationToken token
    ) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(symbols));
        unique.removeIf(Objects::isNull);

        List<List<String>> groups = partition(unique, groupSize());
        Map<String, T> results = new LinkedHashMap<>();
        int omitted = 0;

        for (int i = 0; i < groups.size(); i++) {
            token.throwIfCancelled();
            if (i > 0) {
                pause(properties.getInterGroupDelay(), token);
                token.throwIfCancelled();
            }

            List<String> group = groups.get(i);
            List<CompletableFuture<T>> futures = new ArrayList<>(group.size());
            for (String symbol : group) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> fetchOne(symbol, fetcher, fallback, token), executor));
            }

            awaitAll(futures);

            for (int j = 0; j < group.size(); j++) {
                T value = futures.get(j).join();
                if (value != null) {
                    results.put(group.get(j), value);
                } else {
                    omitted++;
                }
            }
        }

        if (omitted > 0) {
            log.warn("batch fetch finished with omitted entries. requested={}, returned={}, omitted={}",
                    unique.size(), results.size(), omitted);
        } else {
            log.debug("batch fetch finished. requested={}, groups={}", unique.size(), groups.size());
        }
        return results;
    }

    private <T> T fetchOne(
            String symbol,
            Function<String, T> fetcher,
            Function<String, T> fallback,
            CancellationToken token
    ) {
        token.throwIfCancelled();

        try {
            T value = fetcher.apply(symbol);
            if (value != null) return value;
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("batch item failed. symbol={}, reason={}", symbol, e.getMessage());
        }

        if (fallback == null) return null;

        try {
            return fallback.apply(symbol);
        } catch (RuntimeException e) {
            log.warn("batch item fallback failed. symbol={}, reason={}", symbol, e.getMessage());
            return null;
        }
    }

    private static <T> void awaitAll(List<CompletableFuture<T>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof CancellationException ce) throw ce;
            throw e;
        }
    }

    private void pause(Duration delay, CancellationToken token) {
        if (delay == null || delay.isZero() || delay.isNegative()) return;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new CancellationException("batch fetch interrupted");
        }
    }

    // 1..10 으로 보정
    private int groupSize() {
        return Math.min(10, Math.max(1, properties.getGroupSize()));
    }

    static <E> List<List<E>> partition(List<E> items, int size) {
        List<List<E>> out = new ArrayList<>();
        for (int from = 0; from < items.size(); from += size) {
            out.add(items.subList(from, Math.min(items.size(), from + size)));
        }
        return out;
    }
}
