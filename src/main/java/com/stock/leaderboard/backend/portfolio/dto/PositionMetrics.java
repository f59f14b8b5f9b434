package com.stock.leaderboard.backend.portfolio.dto;

import com.stock.leaderboard.backend.market.resolver.PriceTier;

import java.math.BigDecimal;

public record PositionMetrics(
        String symbol,
        String sector,
        int shares,
        BigDecimal avgPrice,
        BigDecimal currentPrice,
        BigDecimal previousClose,
        PriceTier priceTier,

        BigDecimal currentValue,
        BigDecimal invested,
        BigDecimal unrealizedGain,
        BigDecimal unrealizedGainPct,   // % 단위 (20.00 = 20%)
        BigDecimal dayChangeValue,
        BigDecimal dayChangePct,

        BigDecimal sinceDateGain,       // 기준일 가격이 주어졌을 때만
        BigDecimal sinceDateGainPct
) {}
