package com.stock.leaderboard.backend.portfolio.dto;

import com.stock.leaderboard.backend.portfolio.Position;

import java.math.BigDecimal;

public record PositionResponse(
        String symbol,
        int shares,
        BigDecimal avgPrice,
        String sector
) {
    public static PositionResponse from(Position p) {
        return new PositionResponse(p.getSymbol(), p.getShares(), p.getAvgPrice(), p.getSector());
    }
}
