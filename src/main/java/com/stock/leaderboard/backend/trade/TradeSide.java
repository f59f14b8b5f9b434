package com.stock.leaderboard.backend.trade;

public enum TradeSide {
    BUY,
    SELL
}
