package com.hyperhook.backend.model;

/**
 * How an order size is rounded before submission: whole units, or a fixed
 * number of decimal places.
 */
public record SizeQuantization(boolean wholeUnits, int decimals) {

    public static final SizeQuantization INTEGER = new SizeQuantization(true, 0);

    public SizeQuantization {
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must be >= 0");
        }
    }

    public static SizeQuantization decimal(int decimals) {
        return new SizeQuantization(false, decimals);
    }
}
