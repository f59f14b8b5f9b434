package com.stock.leaderboard.backend.exception;

import lombok.Getter;

/**
 * 호출자 쪽 요청 한도 초과. 429 + Retry-After 로 내려간다.
 */
@Getter
public class RateLimitExceededException extends RuntimeException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
