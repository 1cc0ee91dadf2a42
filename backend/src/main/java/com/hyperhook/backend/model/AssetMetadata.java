package com.hyperhook.backend.model;

public record AssetMetadata(
        String symbol,
        int maxLeverage,
        int szDecimals,
        int universeIndex
) {
}
