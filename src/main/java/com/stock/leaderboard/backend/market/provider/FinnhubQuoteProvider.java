package com.stock.leaderboard.backend.market.provider;

import com.stock.leaderboard.backend.market.client.FinnhubClient;
import com.stock.leaderboard.backend.market.dto.FinnhubCandleResponseDTO;
import com.stock.leaderboard.backend.market.dto.FinnhubDividendDTO;
import com.stock.leaderboard.backend.market.dto.FinnhubQuoteDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "market.provider", havingValue = "finnhub", matchIfMissing = true)
public class FinnhubQuoteProvider implements QuoteProvider {

    private static final String NAME = "finnhub";

    private final FinnhubClient finnhubClient;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderQuote getQuote(String symbol) {
        FinnhubQuoteDTO dto;
        try {
            dto = finnhubClient.getQuote(symbol);
        } catch (RestClientException e) {
            throw new QuoteProviderException(NAME, symbol, "quote request failed", e);
        }

        // 존재하지 않는 심볼이면 Finnhub 는 200 + c=0 을 준다
        if (dto == null || dto.getC() == null || dto.getC() <= 0) {
            throw new QuoteProviderException(NAME, symbol, "empty quote");
        }

        double price = dto.getC();
        double previousClose = dto.getPc() == null ? price : dto.getPc();
        Instant timestamp = dto.getT() == null ? null : Instant.ofEpochSecond(dto.getT());

        return new ProviderQuote(
                symbol,
                price,
                dto.getD() == null ? price - previousClose : dto.getD(),
                dto.getDp() == null ? 0.0 : dto.getDp(),
                previousClose,
                timestamp
        );
    }

    @Override
    public List<DailyClose> getHistoricalRange(String symbol, LocalDate from, LocalDate to) {
        long fromEpoch = from.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
        long toEpoch = to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toEpochSecond() - 1;

        FinnhubCandleResponseDTO body;
        try {
            body = finnhubClient.getDailyCandles(symbol, fromEpoch, toEpoch);
        } catch (RestClientException e) {
            throw new QuoteProviderException(NAME, symbol, "candle request failed", e);
        }

        if (body == null) {
            throw new QuoteProviderException(NAME, symbol, "candle body is null");
        }
        if (!"ok".equalsIgnoreCase(body.getS()) || body.getT() == null || body.getC() == null) {
            log.debug("[Finnhub] no candle data. symbol={}, status={}", symbol, body.getS());
            return List.of();
        }

        int n = Math.min(body.getT().size(), body.getC().size());
        List<DailyClose> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Long t = body.getT().get(i);
            Double c = body.getC().get(i);
            if (t == null || c == null) continue;
            LocalDate date = Instant.ofEpochSecond(t).atZone(ZoneOffset.UTC).toLocalDate();
            out.add(new DailyClose(date, c));
        }
        out.sort(Comparator.comparing(DailyClose::date));
        return out;
    }

    @Override
    public List<DividendPayment> getDividends(String symbol, LocalDate from, LocalDate to) {
        List<FinnhubDividendDTO> body;
        try {
            body = finnhubClient.getDividends(symbol, from.toString(), to.toString());
        } catch (RestClientException e) {
            throw new QuoteProviderException(NAME, symbol, "dividend request failed", e);
        }

        List<DividendPayment> out = new ArrayList<>();
        for (FinnhubDividendDTO d : body) {
            if (d == null || d.getDate() == null || d.getAmount() == null) continue;
            try {
                out.add(new DividendPayment(LocalDate.parse(d.getDate()), d.getAmount()));
            } catch (DateTimeParseException e) {
                log.warn("[Finnhub] bad dividend date. symbol={}, date={}", symbol, d.getDate());
            }
        }
        return out;
    }
}
