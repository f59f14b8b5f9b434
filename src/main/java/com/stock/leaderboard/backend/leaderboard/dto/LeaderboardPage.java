package com.stock.leaderboard.backend.leaderboard.dto;

import java.time.Instant;
import java.util.List;

public record LeaderboardPage(
        List<LeaderboardEntry> entries,
        int page,
        int pageSize,
        int total,       // 필터 적용 후 전체 건수
        Instant asOf
) {}
