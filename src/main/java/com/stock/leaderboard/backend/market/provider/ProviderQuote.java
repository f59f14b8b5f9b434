package com.stock.leaderboard.backend.market.provider;

import java.time.Instant;

public record ProviderQuote(
        String symbol,
        double price,
        double change,
        double changePercent,
        double previousClose,
        Instant timestamp
) {
    public boolean isUsable() {
        return Double.isFinite(price) && price > 0;
    }
}
