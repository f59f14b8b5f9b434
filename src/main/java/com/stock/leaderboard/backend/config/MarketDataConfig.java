package com.stock.leaderboard.backend.config;

import com.stock.leaderboard.backend.market.scheduler.BatchFetchProperties;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class MarketDataConfig {

    @Value("${market.http.connect-timeout-ms:2000}")
    private long connectTimeoutMs;

    @Value("${market.http.read-timeout-ms:5000}")
    private long readTimeoutMs;

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    // 시간은 전부 이 Clock 으로 읽는다 (테스트에서 교체)
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "marketDataExecutor")
    public ThreadPoolTaskExecutor marketDataExecutor(BatchFetchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPoolSize());
        executor.setMaxPoolSize(properties.getPoolSize());
        executor.setThreadNamePrefix("market-fetch-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "cacheSweepScheduler")
    public ThreadPoolTaskScheduler cacheSweepScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cache-sweep-");
        scheduler.initialize();
        return scheduler;
    }
}
