package com.stock.leaderboard.backend.market.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "market.price-query")
public class PriceQueryProperties {

    private int maxSymbols = 50;

    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        private int maxRequests = 100;
        private Duration window = Duration.ofMinutes(15);
    }
}
