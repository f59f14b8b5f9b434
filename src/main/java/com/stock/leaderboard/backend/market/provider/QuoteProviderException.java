package com.stock.leaderboard.backend.market.provider;

import lombok.Getter;

@Getter
public class QuoteProviderException extends RuntimeException {

    private final String provider;
    private final String symbol;

    public QuoteProviderException(String provider, String symbol, String message) {
        super(provider + " " + message + ". symbol=" + symbol);
        this.provider = provider;
        this.symbol = symbol;
    }

    public QuoteProviderException(String provider, String symbol, String message, Throwable cause) {
        super(provider + " " + message + ". symbol=" + symbol, cause);
        this.provider = provider;
        this.symbol = symbol;
    }
}
