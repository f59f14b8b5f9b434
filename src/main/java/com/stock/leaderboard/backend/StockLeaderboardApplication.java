package com.stock.leaderboard.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StockLeaderboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockLeaderboardApplication.class, args);
    }
}
