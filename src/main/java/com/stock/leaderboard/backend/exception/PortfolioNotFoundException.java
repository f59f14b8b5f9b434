package com.stock.leaderboard.backend.exception;

import lombok.Getter;

@Getter
public class PortfolioNotFoundException extends RuntimeException {

    private final String userId;

    public PortfolioNotFoundException(String userId) {
        super("포트폴리오를 찾을 수 없습니다. userId=" + userId);
        this.userId = userId;
    }
}
