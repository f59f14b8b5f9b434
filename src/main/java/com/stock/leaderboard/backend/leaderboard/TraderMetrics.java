package com.stock.leaderboard.backend.leaderboard;

import java.math.BigDecimal;

public record TraderMetrics(
        BigDecimal pnl,
        BigDecimal winRate,        // %
        BigDecimal sharpe,
        BigDecimal avgReturn,      // %
        int trades,
        BigDecimal totalValue,
        BigDecimal totalReturnPct,
        BigDecimal dayChangePct
) {}
