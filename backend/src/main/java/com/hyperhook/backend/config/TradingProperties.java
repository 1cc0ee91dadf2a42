package com.hyperhook.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "hyperhook.trading")
public class TradingProperties {

    @Min(1)
    @Max(100)
    private int defaultAmountPercent = 5;

    @DecimalMin("0.0001")
    @DecimalMax("0.5")
    private BigDecimal slippage = new BigDecimal("0.01");

    // Assets that only trade in whole units
    private List<String> integerSizeAssets = new ArrayList<>(List.of("XRP", "DOGE", "SHIB", "FARTCOIN"));

    @Min(0)
    @Max(8)
    private int sizeDecimals = 4;

    private boolean parallelClose = false;
}
