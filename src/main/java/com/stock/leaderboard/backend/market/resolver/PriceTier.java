package com.stock.leaderboard.backend.market.resolver;

/**
 * 가격 출처 등급. 호출자가 실제 시세와 추정치를 구분할 수 있어야 한다.
 */
public enum PriceTier {
    LIVE,       // 외부 시세 API 응답
    REFERENCE,  // 정적 기준가 테이블
    ESTIMATED;  // 기준가에서 결정적으로 추정

    public boolean isLive() {
        return this == LIVE;
    }
}
