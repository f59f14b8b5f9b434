package com.stock.leaderboard.backend.market.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 같은 키에 대한 동시 upstream 호출을 하나로 합친다.
 * <p>
 * 먼저 들어온 호출자가 자기 스레드에서 producer 를 실행하고, 그 사이에 들어온 호출자들은
 * 같은 future 에 붙어 동일한 값 또는 동일한 예외를 받는다. 결과가 나오면(성공/실패 모두)
 * 진행 중 표시는 바로 지워져서 다음 호출은 새로 시작한다. 실패는 캐시되지 않는다.
 */
@Slf4j
@Component
public class RequestCoalescer {

    private final ConcurrentHashMap<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong started = new AtomicLong();
    private final AtomicLong joined = new AtomicLong();

    @SuppressWarnings("unchecked")
    public <T> T runExclusive(String key, Supplier<T> producer) {
        CompletableFuture<Object> mine = new CompletableFuture<>();

        // check-then-insert 를 원자적으로
        CompletableFuture<Object> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            joined.incrementAndGet();
            log.debug("joined in-flight request. key={}", key);
            return (T) await(existing);
        }

        started.incrementAndGet();
        T value;
        try {
            value = producer.get();
        } catch (RuntimeException | Error e) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(e);
            throw e;
        }

        inFlight.remove(key, mine);
        mine.complete(value);
        return value;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    public CoalescerStats stats() {
        return new CoalescerStats(inFlight.size(), started.get(), joined.get());
    }

    private static Object await(CompletableFuture<Object> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }
}
