package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.exception.BadRequestException;

public enum SortOrder {
    ASC, DESC;

    public static SortOrder from(String raw) {
        if (raw == null || raw.isBlank()) return DESC;
        if ("asc".equalsIgnoreCase(raw.trim())) return ASC;
        if ("desc".equalsIgnoreCase(raw.trim())) return DESC;
        throw new BadRequestException("order", "order 는 asc 또는 desc 입니다. order=" + raw);
    }
}
