package com.stock.leaderboard.backend.trade;

import com.stock.leaderboard.backend.trade.dto.CreateTradeRequest;
import com.stock.leaderboard.backend.trade.dto.TradeResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/portfolios/{userId}/trades")
@Tag(name = "Trades")
public class TradeController {

    private final TradeService tradeService;

    @PostMapping
    public ResponseEntity<TradeResponse> create(
            @PathVariable String userId,
            @RequestBody CreateTradeRequest req
    ) {
        return ResponseEntity.ok(tradeService.create(userId, req));
    }

    //최신 거래부터
    @GetMapping
    public List<TradeResponse> list(@PathVariable String userId) {
        return tradeService.getTrades(userId);
    }
}
