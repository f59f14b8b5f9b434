package com.stock.leaderboard.backend.market.resolver;

import com.stock.leaderboard.backend.market.provider.DailyClose;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

// 주말만 휴장으로 본다. 공휴일은 live 조회의 ±윈도우가 흡수한다.
public final class TradingCalendar {

    private static final int MAX_SHIFT_DAYS = 7;

    private TradingCalendar() {}

    public static boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    /**
     * 앞으로 먼저 찾고(최대 7일), 없으면 뒤로 찾는다.
     */
    public static LocalDate nearestTradingDay(LocalDate date) {
        LocalDate check = date;
        for (int i = 0; i < MAX_SHIFT_DAYS && !isTradingDay(check); i++) {
            check = check.plusDays(1);
        }
        if (isTradingDay(check)) return check;

        check = date;
        for (int i = 0; i < MAX_SHIFT_DAYS && !isTradingDay(check); i++) {
            check = check.minusDays(1);
        }
        return check;
    }

    /**
     * target 에 가장 가까운 봉. 거리가 같으면 이른 날짜가 이긴다.
     */
    public static Optional<DailyClose> closestBar(List<DailyClose> bars, LocalDate target) {
        DailyClose best = null;
        long bestDiff = Long.MAX_VALUE;

        List<DailyClose> sorted = bars.stream()
                .filter(bar -> bar != null && bar.close() > 0)
                .sorted(Comparator.comparing(DailyClose::date))
                .toList();

        for (DailyClose bar : sorted) {
            long diff = Math.abs(ChronoUnit.DAYS.between(bar.date(), target));
            if (diff < bestDiff) {
                bestDiff = diff;
                best = bar;
            }
        }
        return Optional.ofNullable(best);
    }
}
