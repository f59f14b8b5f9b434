package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.exception.BadRequestException;

import java.time.LocalDateTime;

public enum LeaderboardPeriod {

    ONE_DAY("1D", 1),
    ONE_WEEK("1W", 7),
    ONE_MONTH("1M", 30),
    ALL("ALL", 0);

    private final String code;
    private final int days;   // 0 = 전체 기간

    LeaderboardPeriod(String code, int days) {
        this.code = code;
        this.days = days;
    }

    public String code() {
        return code;
    }

    /**
     * 거래 집계 시작 시각. ALL 은 null (제한 없음).
     */
    public LocalDateTime windowStart(LocalDateTime now) {
        return days == 0 ? null : now.minusDays(days);
    }

    public static LeaderboardPeriod from(String raw) {
        if (raw == null || raw.isBlank()) return ONE_DAY;
        for (LeaderboardPeriod p : values()) {
            if (p.code.equalsIgnoreCase(raw.trim())) return p;
        }
        throw new BadRequestException("period", "지원하지 않는 period 입니다. (1D, 1W, 1M, ALL) period=" + raw);
    }
}
