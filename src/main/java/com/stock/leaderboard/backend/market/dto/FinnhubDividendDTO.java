package com.stock.leaderboard.backend.market.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubDividendDTO {
    private String symbol;
    private String date;      // ex-dividend date (yyyy-MM-dd)
    private Double amount;
    private String payDate;
}
