package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.exception.BadRequestException;

import java.math.BigDecimal;
import java.util.function.Function;

public enum LeaderboardSortKey {

    PNL("pnl", TraderMetrics::pnl),
    WIN_RATE("winRate", TraderMetrics::winRate),
    SHARPE("sharpe", TraderMetrics::sharpe),
    AVG_RETURN("avgReturn", TraderMetrics::avgReturn),
    TRADES("trades", m -> BigDecimal.valueOf(m.trades())),
    TOTAL_VALUE("totalValue", TraderMetrics::totalValue),
    TOTAL_RETURN_PCT("totalReturnPct", TraderMetrics::totalReturnPct),
    DAY_CHANGE_PCT("dayChangePct", TraderMetrics::dayChangePct);

    private final String code;
    private final Function<TraderMetrics, BigDecimal> extractor;

    LeaderboardSortKey(String code, Function<TraderMetrics, BigDecimal> extractor) {
        this.code = code;
        this.extractor = extractor;
    }

    public String code() {
        return code;
    }

    public BigDecimal valueOf(TraderMetrics metrics) {
        BigDecimal v = extractor.apply(metrics);
        return v == null ? BigDecimal.ZERO : v;
    }

    public static LeaderboardSortKey from(String raw) {
        if (raw == null || raw.isBlank()) return PNL;
        for (LeaderboardSortKey k : values()) {
            if (k.code.equalsIgnoreCase(raw.trim())) return k;
        }
        throw new BadRequestException("sort", "지원하지 않는 정렬 기준입니다. sort=" + raw);
    }
}
