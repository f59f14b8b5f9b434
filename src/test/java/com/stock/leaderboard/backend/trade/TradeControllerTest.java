package com.stock.leaderboard.backend.trade;

import com.stock.leaderboard.backend.exception.BadRequestException;
import com.stock.leaderboard.backend.trade.dto.TradeResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TradeController.class)
class TradeControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean TradeService tradeService;

    @Test
    void oversell_is_400_on_shares() throws Exception {
        when(tradeService.create(eq("amit"), any()))
                .thenThrow(new BadRequestException("shares", "보유수량 초과 매도입니다. symbol=AAPL, holding=1, sell=5"));

        mockMvc.perform(post("/api/portfolios/amit/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"AAPL\",\"side\":\"SELL\",\"shares\":5,\"priceUsd\":200}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("shares"));
    }

    @Test
    void list_returns_trades() throws Exception {
        when(tradeService.getTrades("amit")).thenReturn(List.of(
                new TradeResponse(1L, "AAPL", TradeSide.BUY, 3, new BigDecimal("190.50"), null,
                        LocalDateTime.of(2025, 7, 30, 10, 0))
        ));

        mockMvc.perform(get("/api/portfolios/amit/trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].symbol").value("AAPL"))
                .andExpect(jsonPath("$[0].side").value("BUY"));
    }

    @Test
    void unknown_side_is_400() throws Exception {
        mockMvc.perform(post("/api/portfolios/amit/trades")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"symbol\":\"AAPL\",\"side\":\"HOLD\",\"shares\":1,\"priceUsd\":200}"))
                .andExpect(status().isBadRequest());
    }
}
