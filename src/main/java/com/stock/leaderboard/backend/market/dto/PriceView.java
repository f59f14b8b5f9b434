package com.stock.leaderboard.backend.market.dto;

import com.stock.leaderboard.backend.market.resolver.PriceTier;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;

import java.time.Instant;

public record PriceView(
        double price,
        double change,
        double changePercent,
        double previousClose,
        PriceTier tier,
        Instant asOf
) {
    public static PriceView from(ResolvedQuote q) {
        return new PriceView(q.price(), q.change(), q.changePercent(), q.previousClose(), q.tier(), q.asOf());
    }
}
