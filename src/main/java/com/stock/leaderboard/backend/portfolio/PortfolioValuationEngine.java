package com.stock.leaderboard.backend.portfolio;

import com.stock.leaderboard.backend.market.resolver.HistoricalPrice;
import com.stock.leaderboard.backend.market.resolver.PriceTier;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioValuation;
import com.stock.leaderboard.backend.portfolio.dto.PositionMetrics;
import com.stock.leaderboard.backend.portfolio.dto.WarningResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.stock.leaderboard.backend.portfolio.PortfolioWarningCodes.*;

/**
 * 포지션 + 시세 → 포지션별/포트폴리오 지표.
 * <p>
 * 포트폴리오 수익률과 일간 등락률은 합산된 원금/전일 평가액을 분모로 계산한다
 * (포지션별 % 를 평균 내지 않는다). 원금이 0이면 수익률은 0.
 */
@Component
@RequiredArgsConstructor
public class PortfolioValuationEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TierLadder tierLadder;
    private final Clock clock;

    @Value("${leaderboard.default-sector:Technology}")
    private String defaultSector = "Technology";

    public PortfolioValuation valuate(Portfolio portfolio, Map<String, ResolvedQuote> quotes) {
        return valuate(portfolio, quotes, Map.of());
    }

    public PortfolioValuation valuate(
            Portfolio portfolio,
            Map<String, ResolvedQuote> quotes,
            Map<String, HistoricalPrice> historicalPrices
    ) {
        List<WarningResponse> warnings = new ArrayList<>();
        List<PositionMetrics> positions = new ArrayList<>();

        BigDecimal totalValue = BigDecimal.ZERO;
        BigDecimal totalInvested = BigDecimal.ZERO;
        BigDecimal totalDayChange = BigDecimal.ZERO;
        BigDecimal totalPriorValue = BigDecimal.ZERO;
        BigDecimal totalSinceGain = null;
        BigDecimal totalSinceBase = BigDecimal.ZERO;

        Map<String, BigDecimal> valueBySector = new LinkedHashMap<>();

        for (Position position : portfolio.getPositions()) {
            String symbol = position.getSymbol();

            // =========================
            // ✅ 시세 방어 (Partial 정책)
            // - 시세가 없거나 비정상이면 이 포지션은 합계에서 제외
            // - 대신 warnings 에 (code, symbol) 기록
            // =========================
            ResolvedQuote quote = quotes.get(symbol);
            if (quote == null) {
                warnings.add(new WarningResponse(QUOTE_UNAVAILABLE, symbol));
                continue;
            }

            double priceRaw = quote.price();
            if (Double.isNaN(priceRaw) || Double.isInfinite(priceRaw) || priceRaw <= 0) {
                warnings.add(new WarningResponse(INVALID_QUOTE_PRICE, symbol));
                continue;
            }
            if (quote.tier() == PriceTier.ESTIMATED) {
                warnings.add(new WarningResponse(ESTIMATED_PRICE, symbol));
            }

            BigDecimal shares = bd(position.getShares());
            BigDecimal price = bd(priceRaw);
            BigDecimal previousClose = quote.previousClose() > 0 ? bd(quote.previousClose()) : price;

            BigDecimal currentValue = shares.multiply(price);
            BigDecimal invested = shares.multiply(position.getAvgPrice());
            BigDecimal unrealizedGain = currentValue.subtract(invested);
            BigDecimal dayChange = shares.multiply(price.subtract(previousClose));
            BigDecimal priorValue = shares.multiply(previousClose);

            BigDecimal sinceGain = null;
            BigDecimal sinceGainPct = null;
            HistoricalPrice since = historicalPrices.get(symbol);
            if (since != null && since.price() > 0) {
                BigDecimal sincePrice = bd(since.price());
                BigDecimal sinceBase = shares.multiply(sincePrice);
                sinceGain = shares.multiply(price.subtract(sincePrice));
                sinceGainPct = pct(sinceGain, sinceBase);

                totalSinceGain = totalSinceGain == null ? sinceGain : totalSinceGain.add(sinceGain);
                totalSinceBase = totalSinceBase.add(sinceBase);
            }

            positions.add(new PositionMetrics(
                    symbol,
                    position.getSector(),
                    position.getShares(),
                    scale6(position.getAvgPrice()),
                    scale6(price),
                    scale6(previousClose),
                    quote.tier(),
                    scale2(currentValue),
                    scale2(invested),
                    scale2(unrealizedGain),
                    scale2(pct(unrealizedGain, invested)),
                    scale2(dayChange),
                    scale2(pct(dayChange, priorValue)),
                    sinceGain == null ? null : scale2(sinceGain),
                    sinceGainPct == null ? null : scale2(sinceGainPct)
            ));

            totalValue = totalValue.add(currentValue);
            totalInvested = totalInvested.add(invested);
            totalDayChange = totalDayChange.add(dayChange);
            totalPriorValue = totalPriorValue.add(priorValue);

            String sector = position.getSector() == null ? defaultSector : position.getSector();
            valueBySector.merge(sector, currentValue, BigDecimal::add);
        }

        BigDecimal totalReturn = totalValue.subtract(totalInvested);
        // 등급은 반올림 전 값으로 판정 (4.996 이 5.00 으로 올라가 B 가 되면 안 됨)
        BigDecimal rawReturnPct = pct(totalReturn, totalInvested);
        BigDecimal totalReturnPct = scale2(rawReturnPct);

        return new PortfolioValuation(
                portfolio.getUserId(),
                scale2(totalValue),
                scale2(totalInvested),
                scale2(totalReturn),
                totalReturnPct,
                scale2(totalDayChange),
                scale2(pct(totalDayChange, totalPriorValue)),
                totalSinceGain == null ? null : scale2(totalSinceGain),
                totalSinceGain == null ? null : scale2(pct(totalSinceGain, totalSinceBase)),
                tierLadder.classify(rawReturnPct),
                primarySector(valueBySector),
                topPerformer(positions, Comparator.naturalOrder()),
                topPerformer(positions, Comparator.reverseOrder()),
                positions,
                warnings,
                clock.instant()
        );
    }

    private String primarySector(Map<String, BigDecimal> valueBySector) {
        String best = null;
        BigDecimal bestValue = null;
        for (Map.Entry<String, BigDecimal> e : valueBySector.entrySet()) {
            if (bestValue == null || e.getValue().compareTo(bestValue) > 0) {
                best = e.getKey();
                bestValue = e.getValue();
            }
        }
        return best == null ? defaultSector : best;
    }

    // order = naturalOrder → 수익률 최고, reverseOrder → 최저. 동률이면 먼저 나온 포지션
    private static String topPerformer(List<PositionMetrics> positions, Comparator<BigDecimal> order) {
        PositionMetrics best = null;
        for (PositionMetrics p : positions) {
            if (best == null || order.compare(p.unrealizedGainPct(), best.unrealizedGainPct()) > 0) {
                best = p;
            }
        }
        return best == null ? null : best.symbol();
    }

    // 분모가 0이면 0 (divide-by-zero 없음)
    static BigDecimal pct(BigDecimal numerator, BigDecimal base) {
        if (base == null || base.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(base, 10, RoundingMode.HALF_UP).multiply(HUNDRED);
    }

    private static BigDecimal bd(double v) {
        return BigDecimal.valueOf(v);
    }

    private static BigDecimal bd(int v) {
        return BigDecimal.valueOf(v);
    }

    private static BigDecimal scale2(BigDecimal v) {
        return v.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal scale6(BigDecimal v) {
        return v.setScale(6, RoundingMode.HALF_UP);
    }
}
