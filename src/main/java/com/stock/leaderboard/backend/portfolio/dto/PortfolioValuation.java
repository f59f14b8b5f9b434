package com.stock.leaderboard.backend.portfolio.dto;

import com.stock.leaderboard.backend.portfolio.PerformanceTier;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record PortfolioValuation(
        String userId,
        BigDecimal totalValue,
        BigDecimal totalInvested,
        BigDecimal totalReturn,
        BigDecimal totalReturnPct,
        BigDecimal dayChangeValue,
        BigDecimal dayChangePct,
        BigDecimal sinceDateGain,
        BigDecimal sinceDateGainPct,
        PerformanceTier tier,
        String primarySector,
        String topPerformer,
        String worstPerformer,
        List<PositionMetrics> positions,
        List<WarningResponse> warnings,
        Instant valuedAt
) {}
