package com.stock.leaderboard.backend.portfolio;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {

    @EntityGraph(attributePaths = "positions")
    Optional<Portfolio> findByUserId(String userId);

    boolean existsByUserId(String userId);

    // 리더보드 동점 정렬 기준 = 등록 순서
    @EntityGraph(attributePaths = "positions")
    List<Portfolio> findAllByOrderByIdAsc();
}
