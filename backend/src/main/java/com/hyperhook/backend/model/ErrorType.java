package com.hyperhook.backend.model;

public enum ErrorType {
    AUTH,
    VALIDATION,
    EXCHANGE,
    PARTIAL
}
