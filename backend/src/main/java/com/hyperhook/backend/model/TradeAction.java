package com.hyperhook.backend.model;

import java.util.Locale;
import java.util.Optional;

public enum TradeAction {
    LONG,
    SHORT,
    CLOSE;

    public static Optional<TradeAction> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(TradeAction.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
