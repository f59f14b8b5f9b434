package com.stock.leaderboard.backend.market.resolver;

import com.stock.leaderboard.backend.market.cache.QuoteCache;
import com.stock.leaderboard.backend.market.cache.RequestCoalescer;
import com.stock.leaderboard.backend.market.provider.DailyClose;
import com.stock.leaderboard.backend.market.provider.DividendPayment;
import com.stock.leaderboard.backend.market.provider.ProviderQuote;
import com.stock.leaderboard.backend.market.provider.QuoteProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * 가격 조회의 단일 진입점.
 * <p>
 * 캐시 → (같은 키 동시 호출 합치기) → live provider → 기준가 테이블 → 결정적 추정 순으로 내려간다.
 * 어떤 경우에도 값을 돌려주며 "데이터 없음"으로 예외를 던지지 않는다.
 * provider 장애는 live 단계에서 흡수하고 다음 단계로 넘어간다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FallbackPriceResolver {

    private static final int HISTORY_LOOKBACK_DAYS = 7;
    private static final int HISTORY_LOOKAHEAD_DAYS = 1;
    private static final int DAYS_PER_QUARTER = 90;

    private final QuoteProvider quoteProvider;
    private final QuoteCache quoteCache;
    private final RequestCoalescer coalescer;
    private final ReferencePriceTable referencePriceTable;
    private final PriceEstimator priceEstimator;
    private final Clock clock;

    public ResolvedQuote resolveCurrentPrice(String symbol) {
        String sym = normalizeSymbol(symbol);

        Optional<ResolvedQuote> cached = quoteCache.getCurrentPrice(sym);
        if (cached.isPresent()) {
            return cached.get();
        }

        return coalescer.runExclusive(QuoteCache.currentKey(sym), () -> {
            // 캐시 확인과 runExclusive 사이에 다른 호출이 채웠을 수 있다
            Optional<ResolvedQuote> filled = quoteCache.getCurrentPrice(sym);
            if (filled.isPresent()) return filled.get();

            ResolvedQuote quote = fetchCurrentPrice(sym);
            quoteCache.putCurrentPrice(quote);
            return quote;
        });
    }

    public HistoricalPrice resolveHistoricalPrice(String symbol, LocalDate date) {
        String sym = normalizeSymbol(symbol);
        if (date == null) {
            throw new IllegalArgumentException("date는 필수입니다.");
        }

        Optional<HistoricalPrice> cached = quoteCache.getHistoricalPrice(sym, date);
        if (cached.isPresent()) {
            return cached.get();
        }

        return coalescer.runExclusive(QuoteCache.historicalKey(sym, date), () -> {
            Optional<HistoricalPrice> filled = quoteCache.getHistoricalPrice(sym, date);
            if (filled.isPresent()) return filled.get();

            HistoricalPrice price = fetchHistoricalPrice(sym, date);
            quoteCache.putHistoricalPrice(price);
            return price;
        });
    }

    public ResolvedDividend resolveDividendTotal(String symbol, LocalDate from, LocalDate to) {
        String sym = normalizeSymbol(symbol);
        if (from == null || to == null || from.isAfter(to)) {
            throw new IllegalArgumentException("from <= to 여야 합니다. from=" + from + ", to=" + to);
        }

        Optional<ResolvedDividend> cached = quoteCache.getDividendTotal(sym, from, to);
        if (cached.isPresent()) {
            return cached.get();
        }

        return coalescer.runExclusive(QuoteCache.dividendKey(sym, from, to), () -> {
            Optional<ResolvedDividend> filled = quoteCache.getDividendTotal(sym, from, to);
            if (filled.isPresent()) return filled.get();

            ResolvedDividend dividend = fetchDividendTotal(sym, from, to);
            quoteCache.putDividendTotal(dividend);
            return dividend;
        });
    }

    // =========================
    // 현재가
    // =========================
    private ResolvedQuote fetchCurrentPrice(String symbol) {
        Instant now = clock.instant();

        try {
            ProviderQuote live = quoteProvider.getQuote(symbol);
            if (live != null && live.isUsable()) {
                log.debug("current price resolved. symbol={}, tier=LIVE, price={}", symbol, live.price());
                return new ResolvedQuote(
                        symbol,
                        live.price(),
                        live.change(),
                        live.changePercent(),
                        live.previousClose() > 0 ? live.previousClose() : live.price(),
                        PriceTier.LIVE,
                        live.timestamp() == null ? now : live.timestamp()
                );
            }
            log.warn("quote provider returned unusable quote. provider={}, symbol={}", quoteProvider.name(), symbol);
        } catch (RuntimeException e) {
            log.warn("quote provider failed. provider={}, symbol={}, reason={}",
                    quoteProvider.name(), symbol, e.getMessage());
        }

        Optional<ReferencePriceTable.AnchorQuote> anchor = referencePriceTable.anchor(symbol);
        if (anchor.isPresent()) {
            log.debug("current price resolved. symbol={}, tier=REFERENCE", symbol);
            return ResolvedQuote.fromChangePercent(
                    symbol, anchor.get().price(), anchor.get().changePercent(), PriceTier.REFERENCE, now);
        }

        double estimated = priceEstimator.estimateCurrent(symbol, today());
        log.debug("current price resolved. symbol={}, tier=ESTIMATED, price={}", symbol, estimated);
        return ResolvedQuote.fromChangePercent(symbol, estimated, 0.0, PriceTier.ESTIMATED, now);
    }

    // =========================
    // 과거 종가
    // =========================
    private HistoricalPrice fetchHistoricalPrice(String symbol, LocalDate date) {
        LocalDate tradingDay = TradingCalendar.nearestTradingDay(date);

        try {
            List<DailyClose> bars = quoteProvider.getHistoricalRange(
                    symbol,
                    tradingDay.minusDays(HISTORY_LOOKBACK_DAYS),
                    tradingDay.plusDays(HISTORY_LOOKAHEAD_DAYS)
            );
            Optional<DailyClose> closest = TradingCalendar.closestBar(bars == null ? List.of() : bars, tradingDay);
            if (closest.isPresent()) {
                return new HistoricalPrice(symbol, date, closest.get().date(), closest.get().close(), PriceTier.LIVE);
            }
            log.debug("no live history. symbol={}, tradingDay={}", symbol, tradingDay);
        } catch (RuntimeException e) {
            log.warn("history provider failed. provider={}, symbol={}, tradingDay={}, reason={}",
                    quoteProvider.name(), symbol, tradingDay, e.getMessage());
        }

        Optional<Double> reference = referencePriceTable.historicalClose(symbol, tradingDay);
        if (reference.isPresent()) {
            return new HistoricalPrice(symbol, date, tradingDay, reference.get(), PriceTier.REFERENCE);
        }

        double estimated = estimateHistorical(symbol, tradingDay);
        return new HistoricalPrice(symbol, date, tradingDay, estimated, PriceTier.ESTIMATED);
    }

    private double estimateHistorical(String symbol, LocalDate tradingDay) {
        Optional<ReferencePriceTable.AnchorQuote> anchor = referencePriceTable.anchor(symbol);
        if (anchor.isPresent()) {
            return priceEstimator.estimate(symbol, anchor.get().price(), anchor.get().asOf(), tradingDay);
        }

        // 기준가가 없으면 현재가(어느 tier 든)를 오늘자 anchor 로 쓴다
        ResolvedQuote current = resolveCurrentPrice(symbol);
        return priceEstimator.estimate(symbol, current.price(), today(), tradingDay);
    }

    // =========================
    // 배당 합계
    // =========================
    private ResolvedDividend fetchDividendTotal(String symbol, LocalDate from, LocalDate to) {
        try {
            List<DividendPayment> payments = quoteProvider.getDividends(symbol, from, to);
            if (payments != null && !payments.isEmpty()) {
                double total = payments.stream()
                        .filter(p -> !p.exDate().isBefore(from) && !p.exDate().isAfter(to))
                        .mapToDouble(DividendPayment::amount)
                        .sum();
                return new ResolvedDividend(symbol, from, to, total, PriceTier.LIVE);
            }
        } catch (RuntimeException e) {
            log.warn("dividend provider failed. provider={}, symbol={}, reason={}",
                    quoteProvider.name(), symbol, e.getMessage());
        }

        Optional<Double> quarterly = referencePriceTable.quarterlyDividend(symbol);
        if (quarterly.isPresent()) {
            long quarters = ChronoUnit.DAYS.between(from, to) / DAYS_PER_QUARTER;
            return new ResolvedDividend(symbol, from, to, quarterly.get() * quarters, PriceTier.REFERENCE);
        }

        return new ResolvedDividend(symbol, from, to, 0.0, PriceTier.ESTIMATED);
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), clock.getZone());
    }

    public static String normalizeSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbol은 필수입니다.");
        }
        return symbol.trim().toUpperCase();
    }
}
