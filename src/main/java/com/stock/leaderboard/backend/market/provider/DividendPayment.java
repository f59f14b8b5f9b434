package com.stock.leaderboard.backend.market.provider;

import java.time.LocalDate;

public record DividendPayment(
        LocalDate exDate,
        double amount
) {}
