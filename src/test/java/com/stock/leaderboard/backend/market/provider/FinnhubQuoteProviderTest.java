package com.stock.leaderboard.backend.market.provider;

import com.stock.leaderboard.backend.market.client.FinnhubClient;
import com.stock.leaderboard.backend.market.dto.FinnhubCandleResponseDTO;
import com.stock.leaderboard.backend.market.dto.FinnhubDividendDTO;
import com.stock.leaderboard.backend.market.dto.FinnhubQuoteDTO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.ResourceAccessException;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FinnhubQuoteProviderTest {

    @Mock FinnhubClient finnhubClient;

    @InjectMocks FinnhubQuoteProvider provider;

    @Test
    void quote_maps_price_change_and_previous_close() {
        FinnhubQuoteDTO dto = new FinnhubQuoteDTO();
        dto.setC(180.0);
        dto.setD(5.0);
        dto.setDp(2.857);
        dto.setPc(175.0);
        dto.setT(1_753_884_000L);
        when(finnhubClient.getQuote("AAPL")).thenReturn(dto);

        ProviderQuote q = provider.getQuote("AAPL");

        assertEquals(180.0, q.price());
        assertEquals(5.0, q.change());
        assertEquals(175.0, q.previousClose());
        assertNotNull(q.timestamp());
    }

    @Test
    void zero_price_is_treated_as_unknown_symbol() {
        FinnhubQuoteDTO dto = new FinnhubQuoteDTO();
        dto.setC(0.0);
        when(finnhubClient.getQuote("ZZZZ")).thenReturn(dto);

        assertThrows(QuoteProviderException.class, () -> provider.getQuote("ZZZZ"));
    }

    @Test
    void transport_error_is_wrapped() {
        when(finnhubClient.getQuote("AAPL")).thenThrow(new ResourceAccessException("read timed out"));

        QuoteProviderException ex = assertThrows(QuoteProviderException.class, () -> provider.getQuote("AAPL"));
        assertInstanceOf(ResourceAccessException.class, ex.getCause());
    }

    @Test
    void candles_are_converted_to_utc_dates_in_order() {
        LocalDate d1 = LocalDate.of(2025, 6, 13);
        LocalDate d2 = LocalDate.of(2025, 6, 16);

        FinnhubCandleResponseDTO body = new FinnhubCandleResponseDTO();
        body.setS("ok");
        body.setT(List.of(epoch(d2), epoch(d1)));
        body.setC(List.of(198.42, 196.45));
        when(finnhubClient.getDailyCandles(eq("AAPL"), anyLong(), anyLong())).thenReturn(body);

        List<DailyClose> bars = provider.getHistoricalRange("AAPL", d1, d2);

        assertEquals(List.of(new DailyClose(d1, 196.45), new DailyClose(d2, 198.42)), bars);
    }

    @Test
    void no_data_status_returns_empty_list() {
        FinnhubCandleResponseDTO body = new FinnhubCandleResponseDTO();
        body.setS("no_data");
        when(finnhubClient.getDailyCandles(eq("AAPL"), anyLong(), anyLong())).thenReturn(body);

        assertTrue(provider.getHistoricalRange("AAPL", LocalDate.of(2025, 6, 13), LocalDate.of(2025, 6, 16)).isEmpty());
    }

    @Test
    void dividends_skip_rows_without_amount() {
        FinnhubDividendDTO ok = new FinnhubDividendDTO();
        ok.setDate("2025-05-12");
        ok.setAmount(0.26);
        FinnhubDividendDTO broken = new FinnhubDividendDTO();
        broken.setDate("2025-02-10");

        LocalDate from = LocalDate.of(2025, 1, 1);
        LocalDate to = LocalDate.of(2025, 6, 30);
        when(finnhubClient.getDividends("AAPL", "2025-01-01", "2025-06-30")).thenReturn(List.of(ok, broken));

        List<DividendPayment> payments = provider.getDividends("AAPL", from, to);

        assertEquals(List.of(new DividendPayment(LocalDate.of(2025, 5, 12), 0.26)), payments);
    }

    private static long epoch(LocalDate d) {
        return d.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }
}
