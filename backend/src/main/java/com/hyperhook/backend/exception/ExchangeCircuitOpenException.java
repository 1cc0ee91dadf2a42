package com.hyperhook.backend.exception;

public class ExchangeCircuitOpenException extends RuntimeException {
    public ExchangeCircuitOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
