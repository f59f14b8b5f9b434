package com.stock.leaderboard.backend.market.dto;

import com.stock.leaderboard.backend.market.resolver.PriceTier;
import com.stock.leaderboard.backend.market.resolver.ResolvedDividend;

import java.time.LocalDate;

public record DividendTotalResponse(
        String symbol,
        LocalDate from,
        LocalDate to,
        double total,
        PriceTier tier
) {
    public static DividendTotalResponse from(ResolvedDividend d) {
        return new DividendTotalResponse(d.symbol(), d.from(), d.to(), d.total(), d.tier());
    }
}
