package com.stock.leaderboard.backend.exception;

public class ResourceAlreadyInUseException extends RuntimeException {

    public ResourceAlreadyInUseException(String message) {
        super(message);
    }
}
