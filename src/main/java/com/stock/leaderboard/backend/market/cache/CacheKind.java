package com.stock.leaderboard.backend.market.cache;

public enum CacheKind {
    CURRENT_PRICE("curr"),
    HISTORICAL_CLOSE("hist"),
    DIVIDEND_TOTAL("div");

    private final String prefix;

    CacheKind(String prefix) {
        this.prefix = prefix;
    }

    public String key(Object... parts) {
        StringBuilder sb = new StringBuilder(prefix);
        for (Object part : parts) {
            sb.append(':').append(part);
        }
        return sb.toString();
    }
}
