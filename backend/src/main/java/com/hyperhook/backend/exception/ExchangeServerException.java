package com.hyperhook.backend.exception;

public class ExchangeServerException extends ExchangeApiException {
    public ExchangeServerException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause);
    }
}
