package com.stock.leaderboard.backend.trade.dto;

import com.stock.leaderboard.backend.trade.TradeSide;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CreateTradeRequest {
    private String symbol;
    private TradeSide side;      // BUY/SELL
    private Integer shares;      // 1 이상
    private BigDecimal priceUsd; // 체결가 스냅샷(필수)
    private String sector;       // 선택 (신규 매수 시)
}
