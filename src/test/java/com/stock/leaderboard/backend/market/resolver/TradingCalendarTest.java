package com.stock.leaderboard.backend.market.resolver;

import com.stock.leaderboard.backend.market.provider.DailyClose;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradingCalendarTest {

    @Test
    void weekdays_are_kept_and_weekends_move_to_monday() {
        LocalDate friday = LocalDate.of(2025, 6, 13);
        LocalDate saturday = LocalDate.of(2025, 6, 14);
        LocalDate sunday = LocalDate.of(2025, 6, 15);
        LocalDate monday = LocalDate.of(2025, 6, 16);

        assertEquals(friday, TradingCalendar.nearestTradingDay(friday));
        assertEquals(monday, TradingCalendar.nearestTradingDay(saturday));
        assertEquals(monday, TradingCalendar.nearestTradingDay(sunday));
    }

    @Test
    void closest_bar_prefers_earlier_date_on_tie() {
        LocalDate target = LocalDate.of(2025, 6, 11);
        List<DailyClose> bars = List.of(
                new DailyClose(LocalDate.of(2025, 6, 12), 12.0),
                new DailyClose(LocalDate.of(2025, 6, 10), 10.0)
        );

        assertEquals(10.0, TradingCalendar.closestBar(bars, target).orElseThrow().close());
    }

    @Test
    void closest_bar_ignores_non_positive_closes() {
        LocalDate target = LocalDate.of(2025, 6, 11);
        List<DailyClose> bars = List.of(
                new DailyClose(target, 0.0),
                new DailyClose(LocalDate.of(2025, 6, 9), 9.0)
        );

        assertEquals(9.0, TradingCalendar.closestBar(bars, target).orElseThrow().close());
        assertTrue(TradingCalendar.closestBar(List.of(), target).isEmpty());
    }
}
