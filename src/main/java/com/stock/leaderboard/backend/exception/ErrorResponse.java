package com.stock.leaderboard.backend.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String code,
        String message,
        String field     // 입력값 오류일 때만 (없으면 생략)
) {
    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }
}
