package com.hyperhook.backend.exception;

public class WalletNotConfiguredException extends RuntimeException {
    public WalletNotConfiguredException(String message) {
        super(message);
    }
}
