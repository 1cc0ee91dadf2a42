package com.hyperhook.backend.exchange.hyperliquid;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Number formatting rules for signed exchange actions.
 */
public final class WireFormat {

    private static final int WIRE_DECIMALS = 8;
    private static final int PERP_PRICE_DECIMALS = 6;
    private static final MathContext PRICE_SIGNIFICANT_FIGURES = new MathContext(5, RoundingMode.HALF_EVEN);

    private WireFormat() {
    }

    /**
     * Renders a price or size the way the exchange hashes it: at most 8 decimals,
     * no trailing zeros, no exponent.
     *
     * @throws IllegalArgumentException if the value needs more than 8 decimals
     */
    public static String floatToWire(BigDecimal value) {
        BigDecimal rounded = value.setScale(WIRE_DECIMALS, RoundingMode.HALF_EVEN);
        if (rounded.compareTo(value) != 0) {
            throw new IllegalArgumentException("floatToWire causes rounding: " + value.toPlainString());
        }
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    /**
     * Limit price for an immediate-or-cancel market order: mid moved by the slippage
     * tolerance, then rounded to 5 significant figures and {@code 6 - szDecimals} decimals.
     */
    public static BigDecimal slippagePrice(BigDecimal mid, boolean isBuy, BigDecimal slippage, int szDecimals) {
        BigDecimal factor = isBuy ? BigDecimal.ONE.add(slippage) : BigDecimal.ONE.subtract(slippage);
        BigDecimal price = mid.multiply(factor).round(PRICE_SIGNIFICANT_FIGURES);
        int decimals = Math.max(0, PERP_PRICE_DECIMALS - szDecimals);
        return price.setScale(decimals, RoundingMode.HALF_EVEN);
    }
}
