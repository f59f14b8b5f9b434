package com.stock.leaderboard.backend.leaderboard.dto;

import com.stock.leaderboard.backend.leaderboard.TraderMetrics;
import com.stock.leaderboard.backend.portfolio.PerformanceTier;

import java.math.BigDecimal;
import java.time.Instant;

public record LeaderboardEntry(
        int rank,                 // 정렬/필터 후에 매겨짐 (0 = 아직 없음)
        String userId,
        String username,
        String displayName,

        BigDecimal totalValue,
        BigDecimal totalInvested,
        BigDecimal totalReturnPct,
        BigDecimal dayChangeValue,
        BigDecimal dayChangePct,
        PerformanceTier tier,
        String primarySector,
        String topPerformer,
        int positionCount,

        TraderMetrics metrics,
        String period,
        Instant computedAt
) {
    public LeaderboardEntry withRank(int rank) {
        return new LeaderboardEntry(
                rank, userId, username, displayName,
                totalValue, totalInvested, totalReturnPct, dayChangeValue, dayChangePct,
                tier, primarySector, topPerformer, positionCount,
                metrics, period, computedAt
        );
    }
}
