package com.stock.leaderboard.backend.trade;

import com.stock.leaderboard.backend.exception.BadRequestException;
import com.stock.leaderboard.backend.exception.PortfolioNotFoundException;
import com.stock.leaderboard.backend.portfolio.Portfolio;
import com.stock.leaderboard.backend.portfolio.PortfolioRepository;
import com.stock.leaderboard.backend.portfolio.Position;
import com.stock.leaderboard.backend.trade.dto.CreateTradeRequest;
import com.stock.leaderboard.backend.trade.dto.TradeResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 매수/매도로 포지션을 갱신하고 거래 내역을 남긴다.
 * 같은 종목 재매수는 가중평균 평단으로 합치고, 전량 매도하면 포지션을 지운다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeService {

    private final PortfolioRepository portfolioRepository;
    private final TradeRepository tradeRepository;
    private final Clock clock;

    @Transactional
    public TradeResponse create(String userId, CreateTradeRequest req) {
        validate(req);

        String symbol = req.getSymbol().trim().toUpperCase();
        int shares = req.getShares();
        BigDecimal price = req.getPriceUsd();
        LocalDateTime now = LocalDateTime.now(clock);

        Portfolio portfolio = portfolioRepository.findByUserId(userId)
                .orElseThrow(() -> new PortfolioNotFoundException(userId));

        Trade trade;
        if (req.getSide() == TradeSide.BUY) {
            Optional<Position> existing = portfolio.findPosition(symbol);
            if (existing.isPresent()) {
                existing.get().merge(shares, price);
                existing.get().updateSector(req.getSector());
            } else {
                portfolio.addPosition(symbol, shares, price, req.getSector());
            }
            trade = Trade.buy(portfolio, symbol, shares, price, now);
        } else {
            // ✅ 보유수량 초과 매도 → 400(BAD_REQUEST)
            Position position = portfolio.findPosition(symbol)
                    .orElseThrow(() -> new BadRequestException(
                            "symbol", "보유하지 않은 종목입니다. symbol=" + symbol));

            if (position.getShares() < shares) {
                throw new BadRequestException(
                        "shares",
                        "보유수량 초과 매도입니다. symbol=" + symbol +
                                ", holding=" + position.getShares() +
                                ", sell=" + shares
                );
            }

            trade = Trade.sell(portfolio, symbol, shares, price, position.getAvgPrice(), now);
            position.reduce(shares);
            if (position.getShares() == 0) {
                portfolio.removePosition(position);
            }
        }

        // portfolio 는 트랜잭션 안에서 관리 중 → 포지션 변경은 flush 시 cascade 로 반영
        Trade saved = tradeRepository.save(trade);
        log.info("trade recorded. userId={}, symbol={}, side={}, shares={}", userId, symbol, trade.getSide(), shares);
        return TradeResponse.from(saved);
    }

    public List<TradeResponse> getTrades(String userId) {
        Portfolio portfolio = portfolioRepository.findByUserId(userId)
                .orElseThrow(() -> new PortfolioNotFoundException(userId));

        return tradeRepository
                .findByPortfolio_IdOrderByTradedAtDesc(portfolio.getId())
                .stream()
                .map(TradeResponse::from)
                .toList();
    }

    private void validate(CreateTradeRequest req) {
        if (req == null) throw new BadRequestException("요청이 비었습니다.");
        if (!StringUtils.hasText(req.getSymbol())) throw new BadRequestException("symbol", "symbol 필수");
        if (req.getSide() == null) throw new BadRequestException("side", "side 필수");

        if (req.getShares() == null || req.getShares() <= 0)
            throw new BadRequestException("shares", "shares는 1 이상");

        if (req.getPriceUsd() == null || req.getPriceUsd().compareTo(BigDecimal.ZERO) <= 0)
            throw new BadRequestException("priceUsd", "priceUsd는 0 초과");
    }
}
