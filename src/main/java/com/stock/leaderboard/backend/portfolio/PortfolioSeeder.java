package com.stock.leaderboard.backend.portfolio;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 데모 포트폴리오 적재. 종목당 budgetUsd 만큼 산 것으로 보고 수량은 floor(budget / 평단).
 * 이미 있는 userId 는 건너뛴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortfolioSeeder {

    private final PortfolioRepository portfolioRepository;
    private final Clock clock;

    @Transactional
    public int seed(SeedFile file) {
        if (file == null || file.portfolios() == null) return 0;

        BigDecimal budget = file.budgetUsd() == null ? BigDecimal.valueOf(1000) : file.budgetUsd();
        int created = 0;

        for (SeedPortfolio sp : file.portfolios()) {
            if (portfolioRepository.existsByUserId(sp.userId())) {
                log.debug("seed skipped, already exists. userId={}", sp.userId());
                continue;
            }

            Portfolio portfolio = Portfolio.of(sp.userId(), sp.username(), sp.displayName(), LocalDateTime.now(clock));
            if (sp.positions() != null) {
                for (SeedPosition pos : sp.positions()) {
                    portfolio.addPosition(
                            pos.symbol().toUpperCase(),
                            sharesFor(budget, pos.avgPrice()),
                            pos.avgPrice(),
                            pos.sector()
                    );
                }
            }
            portfolioRepository.save(portfolio);
            created++;
        }
        return created;
    }

    // 평단이 예산보다 비싸면 0주 (포지션은 남긴다)
    static int sharesFor(BigDecimal budget, BigDecimal avgPrice) {
        if (avgPrice == null || avgPrice.signum() <= 0) return 0;
        return budget.divide(avgPrice, 0, RoundingMode.FLOOR).intValue();
    }

    public record SeedFile(BigDecimal budgetUsd, List<SeedPortfolio> portfolios) {}

    public record SeedPortfolio(String userId, String username, String displayName, List<SeedPosition> positions) {}

    public record SeedPosition(String symbol, BigDecimal avgPrice, String sector) {}
}
