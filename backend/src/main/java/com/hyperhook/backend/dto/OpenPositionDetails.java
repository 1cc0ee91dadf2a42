package com.hyperhook.backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OpenPositionDetails(
        String asset,
        String side,
        String size,
        int leverage,
        @JsonProperty("usd_value") String usdValue
) {
}
