package com.stock.leaderboard.backend.trade.dto;

import com.stock.leaderboard.backend.trade.Trade;
import com.stock.leaderboard.backend.trade.TradeSide;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record TradeResponse(
        Long id,
        String symbol,
        TradeSide side,
        Integer shares,
        BigDecimal priceUsd,
        BigDecimal realizedPnlUsd,
        LocalDateTime tradedAt
) {
    public static TradeResponse from(Trade t) {
        return new TradeResponse(
                t.getId(),
                t.getSymbol(),
                t.getSide(),
                t.getShares(),
                t.getPriceUsd(),
                t.getRealizedPnlUsd(),
                t.getTradedAt()
        );
    }
}
