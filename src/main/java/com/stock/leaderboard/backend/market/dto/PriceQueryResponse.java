package com.stock.leaderboard.backend.market.dto;

import java.util.Map;

public record PriceQueryResponse(
        Map<String, PriceView> data,
        PriceQueryMetadata metadata
) {}
