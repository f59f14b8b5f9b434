package com.stock.leaderboard.backend.market.resolver;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

/**
 * 외부 시세를 못 받을 때 쓰는 정적 기준가.
 * <ul>
 *   <li>anchor: 2025-07-30 기준 현재가/등락률</li>
 *   <li>historical close: 특정 (심볼, 거래일) 종가</li>
 *   <li>quarterly dividend: 분기 배당금</li>
 * </ul>
 */
@Component
public class ReferencePriceTable {

    public static final LocalDate ANCHOR_DATE = LocalDate.of(2025, 7, 30);

    private static final LocalDate JUNE_16_2025 = LocalDate.of(2025, 6, 16);

    private static final Map<String, AnchorQuote> ANCHORS = Map.ofEntries(
            anchorOf("RKLB", 15.23, 2.5),
            anchorOf("AMZN", 142.65, -0.8),
            anchorOf("SOFI", 8.45, 3.2),
            anchorOf("ASTS", 12.89, 1.8),
            anchorOf("BRK.B", 345.67, 0.5),
            anchorOf("CELH", 67.34, -1.2),
            anchorOf("OSCR", 23.45, 4.1),
            anchorOf("EOG", 123.78, 0.9),
            anchorOf("BROS", 34.56, 2.3),
            anchorOf("ABCL", 18.90, -0.5),
            anchorOf("PLTR", 158.80, 5.2),
            anchorOf("HOOD", 104.85, -2.1),
            anchorOf("TSLA", 316.06, 3.8),
            anchorOf("AMD", 166.47, 1.5),
            anchorOf("JPM", 298.62, -0.3),
            anchorOf("NBIS", 50.46, 2.7),
            anchorOf("GRAB", 4.71, -1.8),
            anchorOf("AAPL", 213.88, 1.2),
            anchorOf("V", 357.04, 0.8),
            anchorOf("DUOL", 364.09, 4.5),
            anchorOf("META", 298.45, 2.1),
            anchorOf("MSTR", 189.67, 8.9),
            anchorOf("MSFT", 325.12, 1.1),
            anchorOf("HIMS", 12.34, -3.2),
            anchorOf("AVGO", 456.78, 0.7),
            anchorOf("CRWD", 234.56, 3.4),
            anchorOf("NFLX", 387.65, -1.5),
            anchorOf("CRM", 198.45, 2.8),
            anchorOf("PYPL", 67.89, -2.3),
            anchorOf("MU", 89.12, 1.9),
            anchorOf("NVDA", 456.78, 4.2),
            anchorOf("NU", 8.90, 3.6),
            anchorOf("NOW", 567.89, 1.4),
            anchorOf("MELI", 1234.56, 0.9),
            anchorOf("SHOP", 67.89, -1.1),
            anchorOf("TTD", 78.45, 2.6),
            anchorOf("ASML", 678.90, 0.3),
            anchorOf("APP", 45.67, 5.1),
            anchorOf("COIN", 123.45, -4.2),
            anchorOf("TSM", 89.67, 1.7),
            anchorOf("UNH", 456.78, 0.6),
            anchorOf("GOOGL", 134.56, 1.8),
            anchorOf("MRVL", 56.78, 2.4),
            anchorOf("AXON", 189.45, 3.1),
            anchorOf("ELF", 123.45, -0.9),
            anchorOf("ORCL", 98.76, 1.3),
            anchorOf("CSCO", 45.67, 0.4),
            anchorOf("LLY", 567.89, 2.7),
            anchorOf("NVO", 98.45, -1.4),
            anchorOf("TTWO", 134.56, 3.5),
            anchorOf("JNJ", 156.78, 0.2),
            anchorOf("SPY", 412.34, 1.2),
            anchorOf("QQQ", 345.67, -0.8),
            anchorOf("BND", 78.90, 0.1)
    );

    private static final Map<String, Map<LocalDate, Double>> HISTORICAL_CLOSES = Map.ofEntries(
            Map.entry("PLTR", Map.of(JUNE_16_2025, 141.41)),
            Map.entry("HOOD", Map.of(JUNE_16_2025, 76.75)),
            Map.entry("TSLA", Map.of(JUNE_16_2025, 329.13)),
            Map.entry("AMD", Map.of(JUNE_16_2025, 126.39)),
            Map.entry("JPM", Map.of(JUNE_16_2025, 270.36)),
            Map.entry("NBIS", Map.of(JUNE_16_2025, 50.46)),
            Map.entry("GRAB", Map.of(JUNE_16_2025, 4.71)),
            Map.entry("AAPL", Map.of(JUNE_16_2025, 198.42)),
            Map.entry("V", Map.of(JUNE_16_2025, 355.48)),
            Map.entry("DUOL", Map.of(JUNE_16_2025, 474.90))
    );

    // 배당 없는 종목도 0.0 으로 명시 (unknown 과 구분)
    private static final Map<String, Double> QUARTERLY_DIVIDENDS = Map.ofEntries(
            Map.entry("AAPL", 0.24), Map.entry("MSFT", 0.28), Map.entry("GOOGL", 0.0),
            Map.entry("AMZN", 0.0), Map.entry("TSLA", 0.0), Map.entry("META", 0.0),
            Map.entry("NVDA", 0.04), Map.entry("JPM", 1.05), Map.entry("UNH", 1.88),
            Map.entry("V", 0.45), Map.entry("JNJ", 1.19), Map.entry("BRK.B", 0.0),
            Map.entry("PLTR", 0.0), Map.entry("HOOD", 0.0), Map.entry("AMD", 0.0),
            Map.entry("RKLB", 0.0), Map.entry("SOFI", 0.0), Map.entry("ASTS", 0.0),
            Map.entry("CELH", 0.0), Map.entry("OSCR", 0.0), Map.entry("EOG", 0.65),
            Map.entry("BROS", 0.0), Map.entry("ABCL", 0.0), Map.entry("NBIS", 0.0),
            Map.entry("GRAB", 0.0), Map.entry("DUOL", 0.0), Map.entry("MSTR", 0.0),
            Map.entry("HIMS", 0.0), Map.entry("AVGO", 1.12), Map.entry("CRWD", 0.0),
            Map.entry("NFLX", 0.0), Map.entry("CRM", 0.0), Map.entry("PYPL", 0.0),
            Map.entry("MU", 0.0), Map.entry("NU", 0.0), Map.entry("NOW", 0.0),
            Map.entry("MELI", 0.0), Map.entry("SHOP", 0.0), Map.entry("TTD", 0.0),
            Map.entry("ASML", 1.40), Map.entry("APP", 0.0), Map.entry("COIN", 0.0),
            Map.entry("TSM", 0.92), Map.entry("MRVL", 0.06), Map.entry("AXON", 0.0),
            Map.entry("ELF", 0.0), Map.entry("ORCL", 0.40), Map.entry("CSCO", 0.40),
            Map.entry("LLY", 1.30), Map.entry("NVO", 3.42), Map.entry("TTWO", 0.0)
    );

    public Optional<AnchorQuote> anchor(String symbol) {
        return Optional.ofNullable(ANCHORS.get(symbol));
    }

    public Optional<Double> historicalClose(String symbol, LocalDate tradingDate) {
        Map<LocalDate, Double> closes = HISTORICAL_CLOSES.get(symbol);
        if (closes == null) return Optional.empty();
        return Optional.ofNullable(closes.get(tradingDate));
    }

    public Optional<Double> quarterlyDividend(String symbol) {
        return Optional.ofNullable(QUARTERLY_DIVIDENDS.get(symbol));
    }

    private static Map.Entry<String, AnchorQuote> anchorOf(String symbol, double price, double changePercent) {
        return Map.entry(symbol, new AnchorQuote(price, changePercent, ANCHOR_DATE));
    }

    public record AnchorQuote(
            double price,
            double changePercent,
            LocalDate asOf
    ) {}
}
