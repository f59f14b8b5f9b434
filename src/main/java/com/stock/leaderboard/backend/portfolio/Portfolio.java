package com.stock.leaderboard.backend.portfolio;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Entity
@Table(
        name = "PORTFOLIOS",
        uniqueConstraints = @UniqueConstraint(name = "uk_portfolios_user", columnNames = "USER_ID")
)
@Getter
@NoArgsConstructor
public class Portfolio {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "PORTFOLIO_ID")
    private Long id;

    @Column(name = "USER_ID", nullable = false, length = 50)
    private String userId;

    @Column(name = "USERNAME", nullable = false, length = 50)
    private String username;

    @Column(name = "DISPLAY_NAME", length = 100)
    private String displayName;

    @OneToMany(mappedBy = "portfolio", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Position> positions = new ArrayList<>();

    @Column(name = "CREATED_AT", nullable = false)
    private LocalDateTime createdAt;

    public static Portfolio of(String userId, String username, String displayName, LocalDateTime createdAt) {
        Portfolio p = new Portfolio();
        p.userId = userId;
        p.username = username;
        p.displayName = displayName == null ? username : displayName;
        p.createdAt = createdAt;
        return p;
    }

    public Optional<Position> findPosition(String symbol) {
        return positions.stream()
                .filter(pos -> pos.getSymbol().equals(symbol))
                .findFirst();
    }

    public Position addPosition(String symbol, int shares, BigDecimal avgPrice, String sector) {
        Position position = Position.of(this, symbol, shares, avgPrice, sector);
        positions.add(position);
        return position;
    }

    public void removePosition(Position position) {
        positions.remove(position);
    }
}
