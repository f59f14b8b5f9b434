package com.stock.leaderboard.backend.controller;

import com.stock.leaderboard.backend.portfolio.PortfolioService;
import com.stock.leaderboard.backend.portfolio.dto.CreatePortfolioRequest;
import com.stock.leaderboard.backend.portfolio.dto.PortfolioResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/portfolios")
@RequiredArgsConstructor
@Tag(name = "Portfolios")
public class PortfolioController {

    private final PortfolioService portfolioService;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public PortfolioResponse create(@Valid @RequestBody CreatePortfolioRequest req) {
        return portfolioService.create(req);
    }

    @Operation(summary = "포트폴리오 평가 (since 가 있으면 기준일 대비 손익 포함)")
    @GetMapping("/{userId}")
    public PortfolioResponse getPortfolio(
            @PathVariable String userId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate since
    ) {
        return portfolioService.getPortfolio(userId, since);
    }
}
