package com.stock.leaderboard.backend.controller;

import com.stock.leaderboard.backend.leaderboard.LeaderboardService;
import com.stock.leaderboard.backend.leaderboard.dto.LeaderboardPage;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/leaderboard")
@RequiredArgsConstructor
@Tag(name = "Leaderboard")
public class LeaderboardController {

    private final LeaderboardService leaderboardService;

    @GetMapping
    public LeaderboardPage leaderboard(
            @RequestParam(defaultValue = "1D") String period,
            @RequestParam(defaultValue = "pnl") String sort,
            @RequestParam(defaultValue = "desc") String order,
            @RequestParam(defaultValue = "1") Integer page,
            @RequestParam(required = false) Integer pageSize,
            @RequestParam(required = false) String q,
            @RequestParam(required = false) String sector
    ) {
        return leaderboardService.rank(period, sort, order, page, pageSize, q, sector);
    }
}
