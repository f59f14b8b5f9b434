package com.stock.leaderboard.backend.market.cache;

import com.stock.leaderboard.backend.market.resolver.HistoricalPrice;
import com.stock.leaderboard.backend.market.resolver.PriceTier;
import com.stock.leaderboard.backend.market.resolver.ResolvedDividend;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * 시세 데이터 종류별(현재가 / 과거 종가 / 배당 합계) 캐시.
 * <p>
 * 종류마다 만료 정책이 다르다. 현재가는 짧게, 과거 종가는 장 마감 후 변하지 않으니 길게,
 * 배당은 하루 단위로 둔다. live 가 아닌 값은 {@code degradedTtl} 만 유지한다.
 */
@Component
public class QuoteCache implements SweepableCache {

    private final QuoteCacheProperties properties;

    private final TtlCache<ResolvedQuote> currentPrices;
    private final TtlCache<HistoricalPrice> historicalCloses;
    private final TtlCache<ResolvedDividend> dividendTotals;

    public QuoteCache(Clock clock, QuoteCacheProperties properties) {
        this.properties = properties;
        this.currentPrices = new TtlCache<>("current-price", clock, properties.getMaxEntries());
        this.historicalCloses = new TtlCache<>("historical-close", clock, properties.getMaxEntries());
        this.dividendTotals = new TtlCache<>("dividend-total", clock, properties.getMaxEntries());
    }

    public static String currentKey(String symbol) {
        return CacheKind.CURRENT_PRICE.key(symbol);
    }

    public static String historicalKey(String symbol, LocalDate date) {
        return CacheKind.HISTORICAL_CLOSE.key(symbol, date);
    }

    public static String dividendKey(String symbol, LocalDate from, LocalDate to) {
        return CacheKind.DIVIDEND_TOTAL.key(symbol, from, to);
    }

    public Optional<ResolvedQuote> getCurrentPrice(String symbol) {
        return currentPrices.get(currentKey(symbol));
    }

    public void putCurrentPrice(ResolvedQuote quote) {
        currentPrices.put(currentKey(quote.symbol()), quote, ttlFor(CacheKind.CURRENT_PRICE, quote.tier()));
    }

    public Optional<HistoricalPrice> getHistoricalPrice(String symbol, LocalDate date) {
        return historicalCloses.get(historicalKey(symbol, date));
    }

    public void putHistoricalPrice(HistoricalPrice price) {
        historicalCloses.put(
                historicalKey(price.symbol(), price.date()),
                price,
                ttlFor(CacheKind.HISTORICAL_CLOSE, price.tier())
        );
    }

    public Optional<ResolvedDividend> getDividendTotal(String symbol, LocalDate from, LocalDate to) {
        return dividendTotals.get(dividendKey(symbol, from, to));
    }

    public void putDividendTotal(ResolvedDividend dividend) {
        dividendTotals.put(
                dividendKey(dividend.symbol(), dividend.from(), dividend.to()),
                dividend,
                ttlFor(CacheKind.DIVIDEND_TOTAL, dividend.tier())
        );
    }

    Duration ttlFor(CacheKind kind, PriceTier tier) {
        switch (kind) {
            case CURRENT_PRICE:
                return tier.isLive() ? properties.getCurrentPriceTtl() : properties.getDegradedTtl();
            case HISTORICAL_CLOSE:
                // 기준가 테이블 값도 과거의 확정값이라 live 와 같이 취급
                return tier == PriceTier.ESTIMATED ? properties.getDegradedTtl() : properties.getHistoricalTtl();
            case DIVIDEND_TOTAL:
                return tier == PriceTier.ESTIMATED ? properties.getDegradedTtl() : properties.getDividendTtl();
            default:
                throw new IllegalStateException("unknown cache kind: " + kind);
        }
    }

    @Override
    public String cacheName() {
        return "quote-cache";
    }

    @Override
    public int evictExpired() {
        return currentPrices.evictExpired()
                + historicalCloses.evictExpired()
                + dividendTotals.evictExpired();
    }

    public List<CacheStats> stats() {
        return List.of(currentPrices.stats(), historicalCloses.stats(), dividendTotals.stats());
    }

    public int size() {
        return currentPrices.size() + historicalCloses.size() + dividendTotals.size();
    }

    public void clear() {
        currentPrices.clear();
        historicalCloses.clear();
        dividendTotals.clear();
    }
}
