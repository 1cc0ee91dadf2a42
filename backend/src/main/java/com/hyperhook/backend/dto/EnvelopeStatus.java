package com.hyperhook.backend.dto;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EnvelopeStatus {
    SUCCESS,
    PARTIAL,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
