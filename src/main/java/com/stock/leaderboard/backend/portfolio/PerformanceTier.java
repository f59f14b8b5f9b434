package com.stock.leaderboard.backend.portfolio;

// 수익률 구간 등급 (S 가 최상위)
public enum PerformanceTier {
    S,
    A,
    B,
    C
}
