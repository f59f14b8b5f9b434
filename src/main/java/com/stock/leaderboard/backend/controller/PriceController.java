package com.stock.leaderboard.backend.controller;

import com.stock.leaderboard.backend.market.dto.DividendTotalResponse;
import com.stock.leaderboard.backend.market.dto.HistoricalPriceResponse;
import com.stock.leaderboard.backend.market.dto.PriceQueryRequest;
import com.stock.leaderboard.backend.market.dto.PriceQueryResponse;
import com.stock.leaderboard.backend.market.service.MarketPriceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/prices")
@RequiredArgsConstructor
@Tag(name = "Prices")
public class PriceController {

    private final MarketPriceService marketPriceService;

    @Operation(summary = "현재가 일괄 조회 (symbols=AAPL,MSFT)")
    @GetMapping
    public PriceQueryResponse getPrices(
            @RequestParam(required = false) String symbols,
            HttpServletRequest request
    ) {
        return marketPriceService.getPrices(MarketPriceService.splitCsv(symbols), request.getRemoteAddr());
    }

    @Operation(summary = "현재가 일괄 조회 (body)")
    @PostMapping
    public PriceQueryResponse postPrices(
            @Valid @RequestBody PriceQueryRequest body,
            HttpServletRequest request
    ) {
        return marketPriceService.getPrices(body.symbols(), request.getRemoteAddr());
    }

    //주말/휴일이면 가까운 거래일 종가
    @GetMapping("/{symbol}/history")
    public HistoricalPriceResponse getHistory(
            @PathVariable String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return marketPriceService.getHistoricalPrice(symbol, date);
    }

    @GetMapping("/{symbol}/dividends")
    public DividendTotalResponse getDividends(
            @PathVariable String symbol,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        return marketPriceService.getDividendTotal(symbol, from, to);
    }
}
