package com.stock.leaderboard.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stock.leaderboard.backend.leaderboard.LeaderboardProperties;
import com.stock.leaderboard.backend.portfolio.PortfolioSeeder;
import com.stock.leaderboard.backend.portfolio.PortfolioSeeder.SeedFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.InputStream;

@Slf4j
@Configuration
@RequiredArgsConstructor
@ConditionalOnProperty(name = "leaderboard.seed.enabled", havingValue = "true")
public class PortfolioSeedInitializer {

    private final PortfolioSeeder portfolioSeeder;
    private final LeaderboardProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @Bean
    CommandLineRunner seedPortfolios() {
        return args -> {
            Resource resource = resourceLoader.getResource(properties.getSeed().getLocation());
            if (!resource.exists()) {
                log.warn("seed file not found. location={}", properties.getSeed().getLocation());
                return;
            }

            try (InputStream in = resource.getInputStream()) {
                SeedFile file = objectMapper.readValue(in, SeedFile.class);
                int created = portfolioSeeder.seed(file);
                log.info("seed portfolios loaded. created={}, location={}", created, properties.getSeed().getLocation());
            }
        };
    }
}
