package com.stock.leaderboard.backend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(BadRequestException e) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorResponse(
                        "BAD_REQUEST",
                        e.getMessage(),
                        e.getField()
                ));
    }

    // @Valid 요청 바디 검증 실패 → 첫 번째 필드 오류만 내려준다
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        FieldError fieldError = e.getBindingResult().getFieldError();
        String field = fieldError == null ? null : fieldError.getField();
        String message = fieldError == null
                ? "요청 값이 올바르지 않습니다."
                : field + ": " + fieldError.getDefaultMessage();

        return ResponseEntity
                .badRequest()
                .body(new ErrorResponse("BAD_REQUEST", message, field));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParam(MissingServletRequestParameterException e) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorResponse(
                        "BAD_REQUEST",
                        e.getParameterName() + "은(는) 필수입니다.",
                        e.getParameterName()
                ));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorResponse(
                        "BAD_REQUEST",
                        e.getName() + " 형식이 올바르지 않습니다. value=" + e.getValue(),
                        e.getName()
                ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity
                .badRequest()
                .body(new ErrorResponse("BAD_REQUEST", "요청 본문을 읽을 수 없습니다."));
    }

    @ExceptionHandler(PortfolioNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(PortfolioNotFoundException e) {
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(
                        "PORTFOLIO_NOT_FOUND",
                        e.getMessage()
                ));
    }

    @ExceptionHandler(ResourceAlreadyInUseException.class)
    public ResponseEntity<ErrorResponse> handleConflict(ResourceAlreadyInUseException e) {
        return ResponseEntity
                .status(409)
                .body(new ErrorResponse(
                        "RESOURCE_ALREADY_IN_USE",
                        e.getMessage()
                ));
    }

    /**
     * 가격 조회 엔드포인트 요청 한도 초과. 프론트가 back-off 할 수 있게 Retry-After 를 같이 준다.
     */
    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimited(RateLimitExceededException e) {
        log.warn("rate limit exceeded. retryAfterSeconds={}", e.getRetryAfterSeconds());
        return ResponseEntity
                .status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(e.getRetryAfterSeconds()))
                .body(new ErrorResponse(
                        "RATE_LIMITED",
                        e.getMessage()
                ));
    }
}
