package com.hyperhook.backend.exchange.hyperliquid;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WireFormatTest {

    @Test
    void stripsTrailingZeros() {
        assertThat(WireFormat.floatToWire(new BigDecimal("0.0400"))).isEqualTo("0.04");
        assertThat(WireFormat.floatToWire(new BigDecimal("50500.0"))).isEqualTo("50500");
        assertThat(WireFormat.floatToWire(new BigDecimal("0.00000000"))).isEqualTo("0");
    }

    @Test
    void neverUsesExponentNotation() {
        assertThat(WireFormat.floatToWire(new BigDecimal("1E+5"))).isEqualTo("100000");
        assertThat(WireFormat.floatToWire(new BigDecimal("1E-8"))).isEqualTo("0.00000001");
    }

    @Test
    void rejectsValuesThatWouldLosePrecision() {
        assertThatThrownBy(() -> WireFormat.floatToWire(new BigDecimal("0.123456789")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buyPriceMovesUpBySlippage() {
        BigDecimal price = WireFormat.slippagePrice(new BigDecimal("50000"), true, new BigDecimal("0.01"), 5);

        assertThat(WireFormat.floatToWire(price)).isEqualTo("50500");
    }

    @Test
    void sellPriceIsRoundedToFiveSignificantFigures() {
        BigDecimal price = WireFormat.slippagePrice(new BigDecimal("0.5123"), false, new BigDecimal("0.01"), 0);

        assertThat(WireFormat.floatToWire(price)).isEqualTo("0.50718");
    }

    @Test
    void decimalsShrinkAsSizeDecimalsGrow() {
        BigDecimal price = WireFormat.slippagePrice(new BigDecimal("3.21987"), true, new BigDecimal("0.01"), 4);

        assertThat(price.scale()).isEqualTo(2);
        assertThat(WireFormat.floatToWire(price)).isEqualTo("3.25");
    }
}
