package com.stock.leaderboard.backend.portfolio;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

@Entity
@Table(
        name = "POSITIONS",
        uniqueConstraints = @UniqueConstraint(name = "uk_positions_portfolio_symbol", columnNames = {"PORTFOLIO_ID", "SYMBOL"})
)
@Getter
@NoArgsConstructor
public class Position {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "POSITION_ID")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "PORTFOLIO_ID", nullable = false)
    private Portfolio portfolio;

    @Column(name = "SYMBOL", nullable = false, length = 20)
    private String symbol;

    @Column(name = "SHARES", nullable = false)
    private int shares;

    // 해외주식 USD 평단: 소수점 고려
    @Column(name = "AVG_PRICE", nullable = false, precision = 19, scale = 6)
    private BigDecimal avgPrice;

    @Column(name = "SECTOR", length = 50)
    private String sector;

    static Position of(Portfolio portfolio, String symbol, int shares, BigDecimal avgPrice, String sector) {
        Position p = new Position();
        p.portfolio = portfolio;
        p.symbol = symbol;
        p.shares = shares;
        p.avgPrice = avgPrice.setScale(6, RoundingMode.HALF_UP);
        p.sector = sector;
        return p;
    }

    /**
     * 추가 매수: 가중평균 평단으로 합친다.
     */
    public void merge(int addShares, BigDecimal price) {
        int total = shares + addShares;
        if (total <= 0) {
            this.shares = 0;
            return;
        }

        BigDecimal cost = avgPrice.multiply(BigDecimal.valueOf(shares))
                .add(price.multiply(BigDecimal.valueOf(addShares)));

        this.avgPrice = cost.divide(BigDecimal.valueOf(total), 6, RoundingMode.HALF_UP);
        this.shares = total;
    }

    // 매도: 평단은 그대로
    public void reduce(int sellShares) {
        this.shares = shares - sellShares;
    }

    public void updateSector(String sector) {
        if (sector != null && !sector.isBlank()) {
            this.sector = sector;
        }
    }
}
