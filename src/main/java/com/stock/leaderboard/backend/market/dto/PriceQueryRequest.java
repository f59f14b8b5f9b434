package com.stock.leaderboard.backend.market.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record PriceQueryRequest(
        @NotEmpty(message = "조회할 심볼이 없습니다.")
        List<String> symbols
) {}
