package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.portfolio.dto.PortfolioValuation;
import com.stock.leaderboard.backend.portfolio.dto.PositionMetrics;
import com.stock.leaderboard.backend.trade.Trade;
import com.stock.leaderboard.backend.trade.TradeSide;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * 평가 결과 + 기간 내 거래 → 리더보드 지표.
 * 입력이 같으면 결과도 같다 (난수/현재시각을 쓰지 않는다).
 */
@Component
@RequiredArgsConstructor
public class TraderMetricsCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final LeaderboardProperties properties;

    public TraderMetrics calculate(PortfolioValuation valuation, List<Trade> tradesInPeriod) {
        List<Trade> sells = tradesInPeriod.stream()
                .filter(t -> t.getSide() == TradeSide.SELL)
                .toList();

        return new TraderMetrics(
                valuation.totalValue().subtract(valuation.totalInvested()),
                winRate(sells),
                sharpe(valuation),
                avgReturn(sells),
                tradesInPeriod.size(),
                valuation.totalValue(),
                valuation.totalReturnPct(),
                valuation.dayChangePct()
        );
    }

    private static BigDecimal winRate(List<Trade> sells) {
        if (sells.isEmpty()) return scale2(BigDecimal.ZERO);

        long wins = sells.stream()
                .filter(t -> t.getRealizedPnlUsd() != null && t.getRealizedPnlUsd().signum() > 0)
                .count();

        return scale2(BigDecimal.valueOf(wins)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(sells.size()), 10, RoundingMode.HALF_UP));
    }

    private static BigDecimal avgReturn(List<Trade> sells) {
        List<BigDecimal> returns = sells.stream()
                .map(Trade::realizedReturnPct)
                .filter(r -> r != null)
                .toList();
        if (returns.isEmpty()) return scale2(BigDecimal.ZERO);

        BigDecimal sum = returns.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        return scale2(sum.divide(BigDecimal.valueOf(returns.size()), 10, RoundingMode.HALF_UP));
    }

    // (포트폴리오 수익률 - 무위험수익률) / 포지션 수익률 표준편차(모표준편차)
    BigDecimal sharpe(PortfolioValuation valuation) {
        List<PositionMetrics> positions = valuation.positions();
        if (positions.size() < 2) return scale2(BigDecimal.ZERO);

        double mean = positions.stream()
                .mapToDouble(p -> p.unrealizedGainPct().doubleValue())
                .average()
                .orElse(0);

        double variance = positions.stream()
                .mapToDouble(p -> {
                    double d = p.unrealizedGainPct().doubleValue() - mean;
                    return d * d;
                })
                .sum() / positions.size();

        double stddev = Math.sqrt(variance);
        if (stddev == 0 || Double.isNaN(stddev)) return scale2(BigDecimal.ZERO);

        double excess = valuation.totalReturnPct().doubleValue() - properties.getRiskFreeRatePct().doubleValue();
        return scale2(BigDecimal.valueOf(excess / stddev));
    }

    private static BigDecimal scale2(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }
}
