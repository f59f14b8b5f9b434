package com.stock.leaderboard.backend.portfolio;

import com.stock.leaderboard.backend.market.resolver.HistoricalPrice;
import com.stock.leaderboard.backend.market.resolver.PriceTier;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioValuation;
import com.stock.leaderboard.backend.portfolio.dto.PositionMetrics;
import com.stock.leaderboard.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

import static com.stock.leaderboard.backend.portfolio.PortfolioWarningCodes.ESTIMATED_PRICE;
import static com.stock.leaderboard.backend.portfolio.PortfolioWarningCodes.QUOTE_UNAVAILABLE;
import static org.junit.jupiter.api.Assertions.*;

class PortfolioValuationEngineTest {

    MutableClock clock;
    PortfolioValuationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-07-30T14:00:00Z"));
        engine = new PortfolioValuationEngine(new TierLadder(new TierProperties()), clock);
    }

    @Test
    void single_position_metrics_are_calculated() {
        Portfolio p = portfolio();
        p.addPosition("AAPL", 10, new BigDecimal("150"), "Technology");

        PortfolioValuation v = engine.valuate(p, Map.of("AAPL", quote("AAPL", 180, 175, PriceTier.LIVE)));

        PositionMetrics m = v.positions().get(0);
        assertEquals(new BigDecimal("1800.00"), m.currentValue());
        assertEquals(new BigDecimal("1500.00"), m.invested());
        assertEquals(new BigDecimal("300.00"), m.unrealizedGain());
        assertEquals(new BigDecimal("20.00"), m.unrealizedGainPct());
        assertEquals(new BigDecimal("50.00"), m.dayChangeValue());
        assertEquals(new BigDecimal("2.86"), m.dayChangePct());

        assertEquals(new BigDecimal("20.00"), v.totalReturnPct());
        assertEquals(PerformanceTier.A, v.tier());
        assertTrue(v.warnings().isEmpty());
    }

    @Test
    void portfolio_percent_uses_aggregated_base_not_average_of_positions() {
        Portfolio p = portfolio();
        p.addPosition("AAPL", 10, new BigDecimal("100"), "Technology");   // +10%  on 1000
        p.addPosition("XOM", 1, new BigDecimal("100"), "Energy");         // +100% on 100

        PortfolioValuation v = engine.valuate(p, Map.of(
                "AAPL", quote("AAPL", 110, 110, PriceTier.LIVE),
                "XOM", quote("XOM", 200, 200, PriceTier.LIVE)
        ));

        // (1100 + 200 - 1100) / 1100 = 18.18%
        assertEquals(new BigDecimal("1300.00"), v.totalValue());
        assertEquals(new BigDecimal("1100.00"), v.totalInvested());
        assertEquals(new BigDecimal("18.18"), v.totalReturnPct());
        assertEquals("Technology", v.primarySector());
        assertEquals("XOM", v.topPerformer());
        assertEquals("AAPL", v.worstPerformer());
        assertEquals(PerformanceTier.A, v.tier());
    }

    @Test
    void zero_invested_gives_zero_return_without_error() {
        Portfolio p = portfolio();
        p.addPosition("NFLX", 0, new BigDecimal("1225.35"), "Technology");

        PortfolioValuation v = engine.valuate(p, Map.of("NFLX", quote("NFLX", 1200, 1190, PriceTier.LIVE)));

        assertEquals(0, v.totalReturnPct().signum());
        assertEquals(0, v.dayChangePct().signum());
        assertEquals(PerformanceTier.C, v.tier());
    }

    @Test
    void empty_portfolio_is_valued_at_zero() {
        PortfolioValuation v = engine.valuate(portfolio(), Map.of());

        assertEquals(new BigDecimal("0.00"), v.totalValue());
        assertEquals(new BigDecimal("0.00"), v.totalReturnPct());
        assertTrue(v.positions().isEmpty());
        assertNull(v.topPerformer());
        assertEquals("Technology", v.primarySector());
    }

    @Test
    void missing_quote_excludes_position_and_warns() {
        Portfolio p = portfolio();
        p.addPosition("AAPL", 10, new BigDecimal("150"), "Technology");
        p.addPosition("GONE", 5, new BigDecimal("10"), "Technology");

        PortfolioValuation v = engine.valuate(p, Map.of("AAPL", quote("AAPL", 180, 175, PriceTier.LIVE)));

        assertEquals(1, v.positions().size());
        assertEquals(new BigDecimal("1500.00"), v.totalInvested());
        assertEquals(1, v.warnings().size());
        assertEquals(QUOTE_UNAVAILABLE, v.warnings().get(0).code());
        assertEquals("GONE", v.warnings().get(0).symbol());
    }

    @Test
    void estimated_price_is_kept_but_flagged() {
        Portfolio p = portfolio();
        p.addPosition("ZZZZ", 1, new BigDecimal("100"), null);

        PortfolioValuation v = engine.valuate(p, Map.of("ZZZZ", quote("ZZZZ", 101, 101, PriceTier.ESTIMATED)));

        assertEquals(1, v.positions().size());
        assertEquals(ESTIMATED_PRICE, v.warnings().get(0).code());
        assertEquals(PriceTier.ESTIMATED, v.positions().get(0).priceTier());
    }

    @Test
    void since_date_gain_is_reported_when_historical_prices_given() {
        Portfolio p = portfolio();
        p.addPosition("AAPL", 10, new BigDecimal("150"), "Technology");
        LocalDate d = LocalDate.of(2025, 6, 16);

        PortfolioValuation v = engine.valuate(
                p,
                Map.of("AAPL", quote("AAPL", 180, 175, PriceTier.LIVE)),
                Map.of("AAPL", new HistoricalPrice("AAPL", d, d, 160.0, PriceTier.REFERENCE))
        );

        assertEquals(new BigDecimal("200.00"), v.positions().get(0).sinceDateGain());
        assertEquals(new BigDecimal("12.50"), v.positions().get(0).sinceDateGainPct());
        assertEquals(new BigDecimal("200.00"), v.sinceDateGain());
    }

    @Test
    void pct_returns_zero_for_zero_base() {
        assertEquals(BigDecimal.ZERO, PortfolioValuationEngine.pct(BigDecimal.TEN, BigDecimal.ZERO));
    }

    @Test
    void tier_is_decided_before_rounding_for_display() {
        Portfolio p = portfolio();
        p.addPosition("AAPL", 1000, new BigDecimal("100"), "Technology");

        // 수익률 4.996% → 표시는 5.00 이지만 B 하한(5) 미만
        PortfolioValuation v = engine.valuate(p, Map.of("AAPL", quote("AAPL", 104.996, 104.996, PriceTier.LIVE)));

        assertEquals(new BigDecimal("5.00"), v.totalReturnPct());
        assertEquals(PerformanceTier.C, v.tier());
    }

    private Portfolio portfolio() {
        return Portfolio.of("u1", "tester", null, LocalDateTime.of(2025, 7, 1, 0, 0));
    }

    private ResolvedQuote quote(String symbol, double price, double previousClose, PriceTier tier) {
        return new ResolvedQuote(symbol, price, price - previousClose, 0.0, previousClose, tier, clock.instant());
    }
}
