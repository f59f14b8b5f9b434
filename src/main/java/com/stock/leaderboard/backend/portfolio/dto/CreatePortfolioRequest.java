package com.stock.leaderboard.backend.portfolio.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreatePortfolioRequest(
        @NotBlank(message = "userId는 필수입니다.")
        @Pattern(regexp = "^[a-zA-Z0-9_-]{2,50}$", message = "영문/숫자/_/- 2~50자")
        String userId,

        @NotBlank(message = "username은 필수입니다.")
        @Size(max = 50)
        String username,

        @Size(max = 100)
        String displayName
) {}
