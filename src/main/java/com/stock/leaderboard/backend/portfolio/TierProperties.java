package com.stock.leaderboard.backend.portfolio;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "valuation.tier")
public class TierProperties {

    // 하한 포함(>=). 순서는 상관없음, TierLadder 가 정렬한다.
    private List<Step> ladder = new ArrayList<>(List.of(
            new Step(PerformanceTier.S, new BigDecimal("30")),
            new Step(PerformanceTier.A, new BigDecimal("15")),
            new Step(PerformanceTier.B, new BigDecimal("5"))
    ));

    private PerformanceTier lowest = PerformanceTier.C;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Step {
        private PerformanceTier tier;
        private BigDecimal minReturnPct;
    }
}
