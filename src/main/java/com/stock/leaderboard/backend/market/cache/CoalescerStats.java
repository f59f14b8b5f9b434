package com.stock.leaderboard.backend.market.cache;

public record CoalescerStats(
        int inFlight,
        long started,   // 실제로 upstream 을 탄 호출 수
        long joined     // 진행 중 호출에 합류한 수
) {}
