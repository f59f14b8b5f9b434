package com.stock.leaderboard.backend.market.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubQuoteDTO {
    private Double c;   // 현재가
    private Double d;   // 전일 대비
    private Double dp;  // 전일 대비 %
    private Double h;   // 고가
    private Double l;   // 저가
    private Double o;   // 시가
    private Double pc;  // 전일 종가
    private Long t;     // timestamp (seconds)
}
