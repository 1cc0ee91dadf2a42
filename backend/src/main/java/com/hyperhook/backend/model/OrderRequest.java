package com.hyperhook.backend.model;

import java.math.BigDecimal;

public record OrderRequest(
        String asset,
        boolean isBuy,
        BigDecimal size,
        BigDecimal slippageTolerance,
        boolean reduceOnly
) {
    public static final BigDecimal DEFAULT_SLIPPAGE = new BigDecimal("0.01");

    public static OrderRequest marketOpen(String asset, boolean isBuy, BigDecimal size, BigDecimal slippage) {
        return new OrderRequest(asset, isBuy, size, slippage == null ? DEFAULT_SLIPPAGE : slippage, false);
    }
}
