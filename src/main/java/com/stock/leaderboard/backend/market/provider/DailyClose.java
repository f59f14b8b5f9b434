package com.stock.leaderboard.backend.market.provider;

import java.time.LocalDate;

public record DailyClose(
        LocalDate date,
        double close
) {}
