package com.stock.leaderboard.backend.trade;

import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDateTime;
import java.util.List;

public interface TradeRepository extends JpaRepository<Trade, Long> {

    List<Trade> findByPortfolio_IdOrderByTradedAtDesc(Long portfolioId);

    List<Trade> findByPortfolio_IdOrderByTradedAtAsc(Long portfolioId);

    // 리더보드 기간(1D/1W/1M) 필터용
    List<Trade> findByPortfolio_IdAndTradedAtGreaterThanEqualOrderByTradedAtAsc(Long portfolioId, LocalDateTime from);
}
