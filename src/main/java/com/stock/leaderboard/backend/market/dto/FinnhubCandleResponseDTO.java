package com.stock.leaderboard.backend.market.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
public class FinnhubCandleResponseDTO {
    private String s;         // "ok" or "no_data"
    private List<Long> t;     // timestamps (seconds)
    private List<Double> c;   // close
}
