package com.hyperhook.backend.model;

import java.util.Locale;

public enum PositionSide {
    LONG,
    SHORT;

    public boolean isBuy() {
        return this == LONG;
    }

    public PositionSide opposite() {
        return this == LONG ? SHORT : LONG;
    }

    /**
     * Lower-case form used in webhook payloads and response envelopes.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
