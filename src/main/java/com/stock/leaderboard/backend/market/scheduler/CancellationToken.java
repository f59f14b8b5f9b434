package com.stock.leaderboard.backend.market.scheduler;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 오래 걸리는 배치를 호출자가 중간에 버릴 수 있게 한다.
 * 그룹 사이, 대기 후, 항목 시작 전에 확인한다.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new CancellationException("batch fetch cancelled");
        }
    }
}
