package com.stock.leaderboard.backend.portfolio;

public final class PortfolioWarningCodes {

    private PortfolioWarningCodes() {}

    public static final String QUOTE_UNAVAILABLE = "QUOTE_UNAVAILABLE"; //특정 종목 시세를 어떤 tier 로도 못 가져온 경우
    public static final String INVALID_QUOTE_PRICE = "INVALID_QUOTE_PRICE";//시세는 받아왔지만 값이 비정상적인 경우
    public static final String ESTIMATED_PRICE = "ESTIMATED_PRICE"; //실시세가 아니라 추정가로 평가된 경우
}
