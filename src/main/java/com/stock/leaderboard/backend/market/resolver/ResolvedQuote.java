package com.stock.leaderboard.backend.market.resolver;

import java.time.Instant;

public record ResolvedQuote(
        String symbol,
        double price,
        double change,          // 전일 대비 금액
        double changePercent,   // 전일 대비 %
        double previousClose,
        PriceTier tier,
        Instant asOf
) {
    /**
     * 전일 종가가 없는 출처(reference/estimated)용. 등락률에서 전일 종가를 역산한다.
     */
    public static ResolvedQuote fromChangePercent(
            String symbol, double price, double changePercent, PriceTier tier, Instant asOf
    ) {
        double previousClose = derivePreviousClose(price, changePercent);
        return new ResolvedQuote(symbol, price, price - previousClose, changePercent, previousClose, tier, asOf);
    }

    static double derivePreviousClose(double price, double changePercent) {
        double base = 1 + changePercent / 100.0;
        if (base <= 0) return price;
        return price / base;
    }
}
