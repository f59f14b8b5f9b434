package com.stock.leaderboard.backend.exception;

import lombok.Getter;

/**
 * 잘못된 요청 입력. 어떤 필드가 왜 잘못됐는지를 함께 전달한다.
 */
@Getter
public class BadRequestException extends RuntimeException {

    private final String field;

    public BadRequestException(String message) {
        this(null, message);
    }

    public BadRequestException(String field, String message) {
        super(message);
        this.field = field;
    }
}
