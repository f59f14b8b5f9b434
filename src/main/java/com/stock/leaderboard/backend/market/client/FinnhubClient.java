package com.stock.leaderboard.backend.market.client;

import com.stock.leaderboard.backend.market.dto.FinnhubCandleResponseDTO;
import com.stock.leaderboard.backend.market.dto.FinnhubDividendDTO;
import com.stock.leaderboard.backend.market.dto.FinnhubQuoteDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Arrays;
import java.util.List;

@Component
@RequiredArgsConstructor
public class FinnhubClient {

    private final RestTemplate restTemplate;

    @Value("${finnhub.base-url:https://finnhub.io/api/v1}")
    private String baseUrl;

    @Value("${finnhub.api-key:}")
    private String apiKey;

    public FinnhubQuoteDTO getQuote(String symbol) {
        String url = UriComponentsBuilder
                .fromHttpUrl(baseUrl + "/quote")
                .queryParam("symbol", symbol)
                .queryParam("token", apiKey)
                .toUriString();

        return restTemplate.getForObject(url, FinnhubQuoteDTO.class);
    }

    public FinnhubCandleResponseDTO getDailyCandles(String symbol, long fromEpochSecond, long toEpochSecond) {
        String url = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .path("/stock/candle")
                .queryParam("symbol", symbol)
                .queryParam("resolution", "D")
                .queryParam("from", fromEpochSecond)
                .queryParam("to", toEpochSecond)
                .queryParam("token", apiKey)
                .toUriString();

        return restTemplate.getForObject(url, FinnhubCandleResponseDTO.class);
    }

    public List<FinnhubDividendDTO> getDividends(String symbol, String from, String to) {
        String url = UriComponentsBuilder
                .fromHttpUrl(baseUrl)
                .path("/stock/dividend")
                .queryParam("symbol", symbol)
                .queryParam("from", from)
                .queryParam("to", to)
                .queryParam("token", apiKey)
                .toUriString();

        FinnhubDividendDTO[] body = restTemplate.getForObject(url, FinnhubDividendDTO[].class);
        return body == null ? List.of() : Arrays.asList(body);
    }
}
