package com.stock.leaderboard.backend.market.client;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

@Component
@RequiredArgsConstructor
public class AlphaVantageClient {

    @Value("${alphavantage.base-url:https://www.alphavantage.co/query}")
    private String baseUrl;

    @Value("${alphavantage.api-key:}")
    private String apiKey;

    private final RestTemplate restTemplate;

    public String getGlobalQuoteRaw(String symbol) {
        String url = String.format(
                "%s?function=GLOBAL_QUOTE&symbol=%s&apikey=%s",
                baseUrl, symbol, apiKey
        );
        return restTemplate.getForObject(url, String.class);
    }

    // compact = 최근 100 거래일
    public String getDailySeriesRaw(String symbol) {
        String url = String.format(
                "%s?function=TIME_SERIES_DAILY&outputsize=compact&symbol=%s&apikey=%s",
                baseUrl, symbol, apiKey
        );
        return restTemplate.getForObject(url, String.class);
    }

    public String getDividendsRaw(String symbol) {
        String url = String.format(
                "%s?function=DIVIDENDS&symbol=%s&apikey=%s",
                baseUrl, symbol, apiKey
        );
        return restTemplate.getForObject(url, String.class);
    }
}
