package com.hyperhook.backend.exception;

public class ExchangeRateLimitException extends RuntimeException {
    public ExchangeRateLimitException(String message) {
        super(message);
    }

    public ExchangeRateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
