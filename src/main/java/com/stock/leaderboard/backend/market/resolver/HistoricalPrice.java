package com.stock.leaderboard.backend.market.resolver;

import java.time.LocalDate;

public record HistoricalPrice(
        String symbol,
        LocalDate date,         // 요청한 날짜
        LocalDate tradingDate,  // 실제로 가격을 가져온 거래일
        double price,
        PriceTier tier
) {}
