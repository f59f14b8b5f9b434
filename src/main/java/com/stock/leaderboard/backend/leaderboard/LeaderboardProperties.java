package com.stock.leaderboard.backend.leaderboard;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "leaderboard")
public class LeaderboardProperties {

    private Duration cacheTtl = Duration.ofSeconds(30);
    private int cacheMaxPages = 100;

    private int defaultPageSize = 25;
    private int maxPageSize = 100;

    private BigDecimal riskFreeRatePct = new BigDecimal("4.5");
    private String defaultSector = "Technology";

    private Seed seed = new Seed();

    @Getter
    @Setter
    public static class Seed {
        private boolean enabled = false;
        private String location = "classpath:seed/portfolios.json";
    }
}
