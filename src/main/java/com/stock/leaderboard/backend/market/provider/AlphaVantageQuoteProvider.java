package com.stock.leaderboard.backend.market.provider;

import com.stock.leaderboard.backend.market.client.AlphaVantageClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "market.provider", havingValue = "alphavantage")
public class AlphaVantageQuoteProvider implements QuoteProvider {

    private static final String NAME = "alphavantage";

    private final AlphaVantageClient alphaVantageClient;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ProviderQuote getQuote(String symbol) {
        JSONObject root = fetch(symbol, "quote", () -> alphaVantageClient.getGlobalQuoteRaw(symbol));

        JSONObject quote = root.optJSONObject("Global Quote");
        if (quote == null || quote.isEmpty()) {
            throw new QuoteProviderException(NAME, symbol, "Global Quote missing");
        }

        double price = quote.optDouble("05. price", 0.0);
        if (!(price > 0)) {
            throw new QuoteProviderException(NAME, symbol, "empty quote");
        }

        return new ProviderQuote(
                symbol,
                price,
                quote.optDouble("09. change", 0.0),
                parsePercent(quote.optString("10. change percent")),
                quote.optDouble("08. previous close", price),
                null
        );
    }

    @Override
    public List<DailyClose> getHistoricalRange(String symbol, LocalDate from, LocalDate to) {
        JSONObject root = fetch(symbol, "daily series", () -> alphaVantageClient.getDailySeriesRaw(symbol));

        JSONObject series = root.optJSONObject("Time Series (Daily)");
        if (series == null) {
            return List.of();
        }

        List<DailyClose> out = new ArrayList<>();
        for (String day : series.keySet()) {
            LocalDate date;
            try {
                date = LocalDate.parse(day);
            } catch (DateTimeParseException e) {
                continue;
            }
            if (date.isBefore(from) || date.isAfter(to)) continue;

            JSONObject bar = series.optJSONObject(day);
            double close = bar == null ? 0.0 : bar.optDouble("4. close", 0.0);
            if (close > 0) out.add(new DailyClose(date, close));
        }
        out.sort(Comparator.comparing(DailyClose::date));
        return out;
    }

    @Override
    public List<DividendPayment> getDividends(String symbol, LocalDate from, LocalDate to) {
        JSONObject root = fetch(symbol, "dividends", () -> alphaVantageClient.getDividendsRaw(symbol));

        JSONArray data = root.optJSONArray("data");
        if (data == null) {
            return List.of();
        }

        List<DividendPayment> out = new ArrayList<>();
        for (int i = 0; i < data.length(); i++) {
            JSONObject row = data.optJSONObject(i);
            if (row == null) continue;
            try {
                LocalDate exDate = LocalDate.parse(row.optString("ex_dividend_date"));
                if (exDate.isBefore(from) || exDate.isAfter(to)) continue;
                out.add(new DividendPayment(exDate, Double.parseDouble(row.optString("amount", "0"))));
            } catch (DateTimeParseException | NumberFormatException e) {
                log.debug("[AlphaVantage] skip dividend row. symbol={}, row={}", symbol, row);
            }
        }
        return out;
    }

    private JSONObject fetch(String symbol, String call, RawCall rawCall) {
        String response;
        try {
            response = rawCall.get();
        } catch (RestClientException e) {
            throw new QuoteProviderException(NAME, symbol, call + " request failed", e);
        }

        if (response == null || response.isBlank()) {
            throw new QuoteProviderException(NAME, symbol, call + " body is empty");
        }

        JSONObject root;
        try {
            root = new JSONObject(response);
        } catch (JSONException e) {
            throw new QuoteProviderException(NAME, symbol, call + " body is not json", e);
        }

        // 무료 키 한도 초과 시 200 + Note/Information 으로 온다
        if (root.has("Note") || root.has("Information") || root.has("Error Message")) {
            log.warn("[AlphaVantage] {} rejected. symbol={}, body={}", call, symbol, prefix(response, 200));
            throw new QuoteProviderException(NAME, symbol, call + " rejected");
        }
        return root;
    }

    private double parsePercent(String s) {
        if (s == null || s.isEmpty()) return 0.0;
        try {
            return Double.parseDouble(s.replace("%", "").trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static String prefix(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    @FunctionalInterface
    private interface RawCall {
        String get();
    }
}
