package com.stock.leaderboard.backend.leaderboard;

import com.stock.leaderboard.backend.leaderboard.dto.LeaderboardEntry;
import com.stock.leaderboard.backend.leaderboard.dto.LeaderboardPage;
import com.stock.leaderboard.backend.market.resolver.FallbackPriceResolver;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;
import com.stock.leaderboard.backend.market.scheduler.BatchFetchScheduler;
import com.stock.leaderboard.backend.portfolio.Portfolio;
import com.stock.leaderboard.backend.portfolio.PortfolioRepository;
import com.stock.leaderboard.backend.portfolio.PortfolioValuationEngine;
import com.stock.leaderboard.backend.portfolio.Position;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioValuation;
import com.stock.leaderboard.backend.trade.Trade;
import com.stock.leaderboard.backend.trade.TradeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 전체 사용자 포트폴리오를 평가해서 순위를 매긴다.
 * <p>
 * 모든 사용자의 심볼을 모아 한 번의 배치로 시세를 가져온 뒤 사용자별로 평가한다.
 * 평가에 실패한 사용자는 건너뛰고(warn) 나머지로 순위를 만든다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaderboardService {

    private final PortfolioRepository portfolioRepository;
    private final TradeRepository tradeRepository;
    private final FallbackPriceResolver resolver;
    private final BatchFetchScheduler batchFetchScheduler;
    private final PortfolioValuationEngine valuationEngine;
    private final TraderMetricsCalculator metricsCalculator;
    private final LeaderboardPageCache pageCache;
    private final LeaderboardProperties properties;
    private final Clock clock;

    public LeaderboardPage rank(
            String period,
            String sort,
            String order,
            Integer page,
            Integer pageSize,
            String q,
            String sector
    ) {
        return rank(LeaderboardQuery.parse(period, sort, order, page, pageSize, q, sector, properties));
    }

    public LeaderboardPage rank(LeaderboardQuery query) {
        Optional<LeaderboardPage> cached = pageCache.get(query);
        if (cached.isPresent()) {
            log.debug("leaderboard cache hit. key={}", query.cacheKey());
            return cached.get();
        }

        List<LeaderboardEntry> candidates = buildEntries(query.period());

        List<LeaderboardEntry> filtered = LeaderboardRanking.filter(candidates, query.q(), query.sector());
        List<LeaderboardEntry> ranked = LeaderboardRanking.assignRanks(
                LeaderboardRanking.sort(filtered, query.sortKey(), query.order())
        );

        LeaderboardPage result = new LeaderboardPage(
                LeaderboardRanking.slice(ranked, query.page(), query.pageSize()),
                query.page(),
                query.pageSize(),
                ranked.size(),
                clock.instant()
        );

        pageCache.put(query, result);
        log.info("leaderboard computed. key={}, candidates={}, total={}",
                query.cacheKey(), candidates.size(), ranked.size());
        return result;
    }

    private List<LeaderboardEntry> buildEntries(LeaderboardPeriod period) {
        List<Portfolio> portfolios = portfolioRepository.findAllByOrderByIdAsc();

        Set<String> symbols = new LinkedHashSet<>();
        for (Portfolio p : portfolios) {
            for (Position pos : p.getPositions()) {
                symbols.add(pos.getSymbol());
            }
        }

        Map<String, ResolvedQuote> quotes = batchFetchScheduler.fetchAll(symbols, resolver::resolveCurrentPrice);

        Instant computedAt = clock.instant();
        LocalDateTime windowStart = period.windowStart(LocalDateTime.now(clock));

        List<LeaderboardEntry> entries = new ArrayList<>(portfolios.size());
        for (Portfolio portfolio : portfolios) {
            try {
                PortfolioValuation valuation = valuationEngine.valuate(portfolio, quotes);
                TraderMetrics metrics = metricsCalculator.calculate(valuation, tradesIn(portfolio, windowStart));
                entries.add(toEntry(portfolio, valuation, metrics, period, computedAt));
            } catch (RuntimeException e) {
                log.warn("leaderboard user skipped. userId={}, reason={}", portfolio.getUserId(), e.getMessage());
            }
        }
        return entries;
    }

    private List<Trade> tradesIn(Portfolio portfolio, LocalDateTime windowStart) {
        if (windowStart == null) {
            return tradeRepository.findByPortfolio_IdOrderByTradedAtAsc(portfolio.getId());
        }
        return tradeRepository.findByPortfolio_IdAndTradedAtGreaterThanEqualOrderByTradedAtAsc(
                portfolio.getId(), windowStart);
    }

    private static LeaderboardEntry toEntry(
            Portfolio portfolio,
            PortfolioValuation v,
            TraderMetrics metrics,
            LeaderboardPeriod period,
            Instant computedAt
    ) {
        return new LeaderboardEntry(
                0,
                portfolio.getUserId(),
                portfolio.getUsername(),
                portfolio.getDisplayName(),
                v.totalValue(),
                v.totalInvested(),
                v.totalReturnPct(),
                v.dayChangeValue(),
                v.dayChangePct(),
                v.tier(),
                v.primarySector(),
                v.topPerformer(),
                portfolio.getPositions().size(),
                metrics,
                period.code(),
                computedAt
        );
    }
}
