package com.stock.leaderboard.backend.market.resolver;

import java.time.LocalDate;

public record ResolvedDividend(
        String symbol,
        LocalDate from,
        LocalDate to,
        double total,
        PriceTier tier
) {}
