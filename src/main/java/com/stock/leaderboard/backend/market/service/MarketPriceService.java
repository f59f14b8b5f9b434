package com.stock.leaderboard.backend.market.service;

import com.stock.leaderboard.backend.exception.BadRequestException;
import com.stock.leaderboard.backend.market.cache.QuoteCache;
import com.stock.leaderboard.backend.market.cache.RequestCoalescer;
import com.stock.leaderboard.backend.market.dto.DividendTotalResponse;
import com.stock.leaderboard.backend.market.dto.HistoricalPriceResponse;
import com.stock.leaderboard.backend.market.dto.PriceQueryMetadata;
import com.stock.leaderboard.backend.market.dto.PriceQueryResponse;
import com.stock.leaderboard.backend.market.dto.PriceView;
import com.stock.leaderboard.backend.market.resolver.FallbackPriceResolver;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;
import com.stock.leaderboard.backend.market.scheduler.BatchFetchScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class MarketPriceService {

    private static final Pattern SYMBOL_PATTERN = Pattern.compile("^[A-Z0-9][A-Z0-9.\\-]{0,9}$");

    private final FallbackPriceResolver resolver;
    private final BatchFetchScheduler batchFetchScheduler;
    private final QuoteCache quoteCache;
    private final RequestCoalescer coalescer;
    private final PriceRequestRateLimiter rateLimiter;
    private final PriceQueryProperties properties;
    private final Clock clock;

    /**
     * 여러 심볼 현재가. 입력 검증 → 요청 한도 → 배치 조회 순서.
     * 어떤 tier 로도 값을 못 만든 심볼은 결과에서 빠진다.
     */
    public PriceQueryResponse getPrices(List<String> rawSymbols, String clientKey) {
        List<String> symbols = normalizeSymbols(rawSymbols);
        rateLimiter.acquire(clientKey);

        Map<String, ResolvedQuote> quotes = batchFetchScheduler.fetchAll(symbols, resolver::resolveCurrentPrice);

        Map<String, PriceView> data = new LinkedHashMap<>();
        for (String symbol : symbols) {
            ResolvedQuote q = quotes.get(symbol);
            if (q != null) data.put(symbol, PriceView.from(q));
        }

        log.info("price query done. client={}, requested={}, returned={}", clientKey, symbols.size(), data.size());

        return new PriceQueryResponse(
                data,
                new PriceQueryMetadata(
                        symbols.size(),
                        data.size(),
                        quoteCache.stats(),
                        coalescer.stats(),
                        clock.instant()
                )
        );
    }

    public HistoricalPriceResponse getHistoricalPrice(String symbol, LocalDate date) {
        String sym = normalizeSymbol(symbol);
        if (date == null) {
            throw new BadRequestException("date", "date는 필수입니다.");
        }
        return HistoricalPriceResponse.from(resolver.resolveHistoricalPrice(sym, date));
    }

    public DividendTotalResponse getDividendTotal(String symbol, LocalDate from, LocalDate to) {
        String sym = normalizeSymbol(symbol);
        if (from == null) throw new BadRequestException("from", "from은 필수입니다.");
        if (to == null) throw new BadRequestException("to", "to는 필수입니다.");
        if (from.isAfter(to)) {
            throw new BadRequestException("from", "from은 to보다 이후일 수 없습니다. from=" + from + ", to=" + to);
        }
        return DividendTotalResponse.from(resolver.resolveDividendTotal(sym, from, to));
    }

    public static List<String> splitCsv(String csv) {
        if (csv == null || csv.isBlank()) return List.of();
        return new ArrayList<>(Arrays.asList(csv.split(",")));
    }

    List<String> normalizeSymbols(List<String> rawSymbols) {
        if (rawSymbols == null || rawSymbols.isEmpty()) {
            throw new BadRequestException("symbols", "조회할 심볼이 없습니다.");
        }

        Set<String> unique = new LinkedHashSet<>();
        for (String raw : rawSymbols) {
            unique.add(normalizeSymbol(raw));
        }

        if (unique.size() > properties.getMaxSymbols()) {
            throw new BadRequestException(
                    "symbols",
                    "한 번에 최대 " + properties.getMaxSymbols() + "개까지 조회할 수 있습니다. requested=" + unique.size()
            );
        }
        return new ArrayList<>(unique);
    }

    private static String normalizeSymbol(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new BadRequestException("symbols", "빈 심볼이 포함되어 있습니다.");
        }
        String symbol = raw.trim().toUpperCase();
        if (!SYMBOL_PATTERN.matcher(symbol).matches()) {
            throw new BadRequestException("symbols", "심볼 형식이 올바르지 않습니다. symbol=" + raw.trim());
        }
        return symbol;
    }
}
