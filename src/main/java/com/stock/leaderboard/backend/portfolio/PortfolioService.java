package com.stock.leaderboard.backend.portfolio;

import com.stock.leaderboard.backend.exception.PortfolioNotFoundException;
import com.stock.leaderboard.backend.exception.ResourceAlreadyInUseException;
import com.stock.leaderboard.backend.market.resolver.FallbackPriceResolver;
import com.stock.leaderboard.backend.market.resolver.HistoricalPrice;
import com.stock.leaderboard.backend.market.resolver.ResolvedQuote;
import com.stock.leaderboard.backend.market.scheduler.BatchFetchScheduler;
import com.stock.leaderboard.backend.portfolio.dto.CreatePortfolioRequest;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioResponse;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioValuation;
import com.stock.leaderboard.backend.portfolio.dto.PositionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final PortfolioRepository portfolioRepository;
    private final FallbackPriceResolver resolver;
    private final BatchFetchScheduler batchFetchScheduler;
    private final PortfolioValuationEngine valuationEngine;
    private final Clock clock;

    @Transactional
    public PortfolioResponse create(CreatePortfolioRequest req) {
        if (portfolioRepository.existsByUserId(req.userId())) {
            throw new ResourceAlreadyInUseException("이미 포트폴리오가 있습니다. userId=" + req.userId());
        }

        Portfolio saved = portfolioRepository.save(
                Portfolio.of(req.userId(), req.username(), req.displayName(), LocalDateTime.now(clock))
        );
        log.info("portfolio created. userId={}", saved.getUserId());

        return new PortfolioResponse(saved.getUserId(), saved.getUsername(), saved.getDisplayName(), List.of(), null);
    }

    /**
     * 현재 시세로 평가한 포트폴리오. since 가 있으면 그 날짜 대비 손익도 같이 계산한다.
     */
    public PortfolioResponse getPortfolio(String userId, LocalDate since) {
        Portfolio portfolio = portfolioRepository.findByUserId(userId)
                .orElseThrow(() -> new PortfolioNotFoundException(userId));

        PortfolioValuation valuation = valuate(portfolio, since);

        List<PositionResponse> positions = portfolio.getPositions().stream()
                .map(PositionResponse::from)
                .toList();

        return new PortfolioResponse(
                portfolio.getUserId(),
                portfolio.getUsername(),
                portfolio.getDisplayName(),
                positions,
                valuation
        );
    }

    PortfolioValuation valuate(Portfolio portfolio, LocalDate since) {
        List<String> symbols = portfolio.getPositions().stream()
                .map(Position::getSymbol)
                .toList();

        Map<String, ResolvedQuote> quotes =
                batchFetchScheduler.fetchAll(symbols, resolver::resolveCurrentPrice);

        Map<String, HistoricalPrice> historical = since == null
                ? Map.of()
                : batchFetchScheduler.fetchAll(symbols, s -> resolver.resolveHistoricalPrice(s, since));

        return valuationEngine.valuate(portfolio, quotes, historical);
    }
}
