package com.stock.leaderboard.backend.trade;

import com.stock.leaderboard.backend.portfolio.Portfolio;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "TRADES",
        indexes = {
                @Index(name = "idx_trades_portfolio_symbol", columnList = "PORTFOLIO_ID, SYMBOL"),
                @Index(name = "idx_trades_portfolio_time", columnList = "PORTFOLIO_ID, TRADED_AT")
        }
)
@Getter
@NoArgsConstructor
public class Trade {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "TRADE_ID")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "PORTFOLIO_ID", nullable = false)
    private Portfolio portfolio;

    @Column(name = "SYMBOL", nullable = false, length = 20)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(name = "SIDE", nullable = false, length = 10)
    private TradeSide side;

    @Column(name = "SHARES", nullable = false)
    private Integer shares;

    @Column(name = "PRICE_USD", nullable = false, precision = 19, scale = 6)
    private BigDecimal priceUsd;

    // SELL 일 때만: 매도 시점 평단과 실현손익
    @Column(name = "COST_BASIS_USD", precision = 19, scale = 6)
    private BigDecimal costBasisUsd;

    @Column(name = "REALIZED_PNL_USD", precision = 19, scale = 6)
    private BigDecimal realizedPnlUsd;

    @Column(name = "TRADED_AT", nullable = false)
    private LocalDateTime tradedAt;

    public static Trade buy(Portfolio portfolio, String symbol, int shares, BigDecimal priceUsd, LocalDateTime tradedAt) {
        Trade t = new Trade();
        t.portfolio = portfolio;
        t.symbol = symbol;
        t.side = TradeSide.BUY;
        t.shares = shares;
        t.priceUsd = priceUsd;
        t.tradedAt = tradedAt;
        return t;
    }

    public static Trade sell(
            Portfolio portfolio,
            String symbol,
            int shares,
            BigDecimal priceUsd,
            BigDecimal costBasisUsd,
            LocalDateTime tradedAt
    ) {
        Trade t = buy(portfolio, symbol, shares, priceUsd, tradedAt);
        t.side = TradeSide.SELL;
        t.costBasisUsd = costBasisUsd;
        t.realizedPnlUsd = priceUsd.subtract(costBasisUsd).multiply(BigDecimal.valueOf(shares));
        return t;
    }

    /**
     * 매도 수익률(%). 매수이거나 평단이 0이면 null.
     */
    public BigDecimal realizedReturnPct() {
        if (side != TradeSide.SELL || costBasisUsd == null || costBasisUsd.signum() == 0) {
            return null;
        }
        return priceUsd.subtract(costBasisUsd)
                .divide(costBasisUsd, 6, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100));
    }
}
