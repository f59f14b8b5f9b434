package com.stock.leaderboard.backend.market.resolver;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.zip.CRC32;

/**
 * 기준가에 추세/변동 factor 를 곱해 가격을 추정한다.
 * 같은 (symbol, date) 면 항상 같은 값이 나온다 (난수 없음).
 */
@Component
public class PriceEstimator {

    public static final double DEFAULT_ANCHOR_PRICE = 100.0;

    private static final double MIN_TREND = 0.7;
    private static final double DAILY_DECAY = 0.0008;
    private static final double VOLATILITY = 0.05;
    private static final double FUTURE_DAILY_DRIFT = 0.0002;
    private static final double MAX_FUTURE_DRIFT = 0.2;
    private static final double NOISE = 0.02;

    /**
     * anchorDate 기준 anchorPrice 에서 target 날짜의 가격을 추정한다.
     */
    public double estimate(String symbol, double anchorPrice, LocalDate anchorDate, LocalDate target) {
        long daysBack = ChronoUnit.DAYS.between(target, anchorDate);

        double factor;
        if (daysBack >= 0) {
            double trend = Math.max(MIN_TREND, 1 - daysBack * DAILY_DECAY);
            double volatility = Math.sin(daysBack / 30.0) * VOLATILITY;
            factor = trend + volatility;
        } else {
            factor = 1 + Math.min(Math.abs(daysBack) * FUTURE_DAILY_DRIFT, MAX_FUTURE_DRIFT);
        }

        return round2(anchorPrice * (factor + noise(symbol, target)));
    }

    /**
     * 기준가가 전혀 없는 심볼의 현재가 추정.
     */
    public double estimateCurrent(String symbol, LocalDate today) {
        return round2(DEFAULT_ANCHOR_PRICE * (1 + noise(symbol, today)));
    }

    // [-NOISE, +NOISE) 범위, (symbol, date) 해시로 결정
    static double noise(String symbol, LocalDate date) {
        CRC32 crc = new CRC32();
        crc.update((symbol + "|" + date).getBytes(StandardCharsets.UTF_8));
        double unit = (crc.getValue() % 10_000L) / 10_000.0;
        return (unit * 2 - 1) * NOISE;
    }

    private static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
