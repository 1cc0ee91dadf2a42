package com.hyperhook.backend.exception;

/**
 * Raised by the position sizer for inputs that can never produce an order
 * (non-positive price or balance, percent out of range).
 */
public class SizingException extends RuntimeException {
    public SizingException(String message) {
        super(message);
    }
}
