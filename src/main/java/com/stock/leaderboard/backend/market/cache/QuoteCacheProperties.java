package com.stock.leaderboard.backend.market.cache;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market.cache")
public class QuoteCacheProperties {

    private Duration currentPriceTtl = Duration.ofMinutes(15);
    private Duration historicalTtl = Duration.ofDays(14);
    private Duration dividendTtl = Duration.ofHours(24);

    // live 가 아닌 값(reference/estimated)은 짧게 들고 있다가 live 복구를 다시 시도
    private Duration degradedTtl = Duration.ofMinutes(1);

    private Duration sweepInterval = Duration.ofMinutes(10);
    private int maxEntries = 10_000;
}
