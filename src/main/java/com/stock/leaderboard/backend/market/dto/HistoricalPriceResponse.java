package com.stock.leaderboard.backend.market.dto;

import com.stock.leaderboard.backend.market.resolver.HistoricalPrice;
import com.stock.leaderboard.backend.market.resolver.PriceTier;

import java.time.LocalDate;

public record HistoricalPriceResponse(
        String symbol,
        LocalDate requestedDate,
        LocalDate tradingDate,
        double price,
        PriceTier tier
) {
    public static HistoricalPriceResponse from(HistoricalPrice p) {
        return new HistoricalPriceResponse(p.symbol(), p.date(), p.tradingDate(), p.price(), p.tier());
    }
}
