package com.hyperhook.backend.model;

import java.math.BigDecimal;

/**
 * An open perpetual position. The sign of {@code signedSize} is the direction.
 */
public record Position(String asset, BigDecimal signedSize) {

    public boolean isOpen() {
        return signedSize != null && signedSize.signum() != 0;
    }

    public PositionSide side() {
        return signedSize.signum() > 0 ? PositionSide.LONG : PositionSide.SHORT;
    }

    public BigDecimal absoluteSize() {
        return signedSize.abs();
    }
}
