package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.market.resolver.PriceTier;
import com.stock.leaderboard.backend.portfolio.PerformanceTier;
import com.stock.leaderboard.backend.portfolio.Portfolio;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioValuation;
import com.stock.leaderboard.backend.portfolio.dto.PositionMetrics;
import com.stock.leaderboard.backend.trade.Trade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraderMetricsCalculatorTest {

    TraderMetricsCalculator calculator = new TraderMetricsCalculator(new LeaderboardProperties());

    Portfolio portfolio = Portfolio.of("u1", "tester", null, LocalDateTime.of(2025, 7, 1, 0, 0));
    LocalDateTime t = LocalDateTime.of(2025, 7, 29, 10, 0);

    @Test
    void pnl_and_valuation_fields_are_copied() {
        TraderMetrics m = calculator.calculate(valuation("10"), List.of());

        assertEquals(new BigDecimal("200.00"), m.pnl());
        assertEquals(new BigDecimal("1200.00"), m.totalValue());
        assertEquals(new BigDecimal("20.00"), m.totalReturnPct());
        assertEquals(0, m.trades());
        assertEquals(new BigDecimal("0.00"), m.winRate());
        assertEquals(new BigDecimal("0.00"), m.avgReturn());
    }

    @Test
    void win_rate_and_avg_return_use_sells_only() {
        List<Trade> trades = List.of(
                Trade.buy(portfolio, "AAPL", 10, new BigDecimal("100"), t),
                Trade.sell(portfolio, "AAPL", 2, new BigDecimal("110"), new BigDecimal("100"), t),   // +10%
                Trade.sell(portfolio, "AAPL", 2, new BigDecimal("90"), new BigDecimal("100"), t),    // -10%
                Trade.sell(portfolio, "AAPL", 2, new BigDecimal("130"), new BigDecimal("100"), t)    // +30%
        );

        TraderMetrics m = calculator.calculate(valuation("10"), trades);

        assertEquals(4, m.trades());
        assertEquals(new BigDecimal("66.67"), m.winRate());
        assertEquals(new BigDecimal("10.00"), m.avgReturn());
    }

    @Test
    void sharpe_is_excess_return_over_position_dispersion() {
        // 포지션 수익률 10, 30 → 평균 20, 모표준편차 10 → (20 - 4.5) / 10
        TraderMetrics m = calculator.calculate(valuation("10", "30"), List.of());

        assertEquals(new BigDecimal("1.55"), m.sharpe());
    }

    @Test
    void sharpe_is_zero_for_single_position_or_no_dispersion() {
        assertEquals(new BigDecimal("0.00"), calculator.calculate(valuation("20"), List.of()).sharpe());
        assertEquals(new BigDecimal("0.00"), calculator.calculate(valuation("20", "20"), List.of()).sharpe());
    }

    // 합계는 원금 1000 / 평가금 1200 (수익률 20%) 고정, 포지션별 수익률만 바꾼다
    private PortfolioValuation valuation(String... positionPcts) {
        List<PositionMetrics> positions = Arrays.stream(positionPcts)
                .map(pct -> new PositionMetrics(
                        "S" + pct, "Technology", 1,
                        BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, PriceTier.LIVE,
                        BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ZERO, new BigDecimal(pct),
                        BigDecimal.ZERO, BigDecimal.ZERO, null, null))
                .toList();

        return new PortfolioValuation(
                "u1",
                new BigDecimal("1200.00"),
                new BigDecimal("1000.00"),
                new BigDecimal("200.00"),
                new BigDecimal("20.00"),
                BigDecimal.ZERO,
                new BigDecimal("0.50"),
                null,
                null,
                PerformanceTier.A,
                "Technology",
                null,
                null,
                positions,
                List.of(),
                Instant.EPOCH
        );
    }
}
