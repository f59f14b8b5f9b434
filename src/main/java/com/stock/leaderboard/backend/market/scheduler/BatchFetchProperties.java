package com.stock.leaderboard.backend.market.scheduler;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market.batch")
public class BatchFetchProperties {

    // 가장 rate limit 이 빡빡한 provider 기준 (Finnhub free: 60 req/min)
    private int groupSize = 5;
    private Duration interGroupDelay = Duration.ofSeconds(1);

    private int poolSize = 8;
}
