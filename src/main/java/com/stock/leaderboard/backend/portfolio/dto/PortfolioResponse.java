package com.stock.leaderboard.backend.portfolio.dto;

import java.util.List;

public record PortfolioResponse(
        String userId,
        String username,
        String displayName,
        List<PositionResponse> positions,
        PortfolioValuation valuation   // 생성 직후 응답에서는 null
) {}
