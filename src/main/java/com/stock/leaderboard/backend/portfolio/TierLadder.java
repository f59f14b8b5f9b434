package com.stock.leaderboard.backend.portfolio;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;

/**
 * totalReturnPct 를 등급으로 바꾸는 단일 기준표. 경계값은 위 등급에 속한다.
 */
@Component
public class TierLadder {

    private final List<TierProperties.Step> steps;
    private final PerformanceTier lowest;

    public TierLadder(TierProperties properties) {
        this.steps = properties.getLadder().stream()
                .filter(s -> s.getTier() != null && s.getMinReturnPct() != null)
                .sorted(Comparator.comparing(TierProperties.Step::getMinReturnPct).reversed())
                .toList();
        this.lowest = properties.getLowest() == null ? PerformanceTier.C : properties.getLowest();
    }

    public PerformanceTier classify(BigDecimal totalReturnPct) {
        if (totalReturnPct == null) return lowest;

        for (TierProperties.Step step : steps) {
            if (totalReturnPct.compareTo(step.getMinReturnPct()) >= 0) {
                return step.getTier();
            }
        }
        return lowest;
    }
}
