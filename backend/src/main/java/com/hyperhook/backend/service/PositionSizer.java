package com.hyperhook.backend.service;

import com.hyperhook.backend.config.TradingProperties;
import com.hyperhook.backend.exception.SizingException;
import com.hyperhook.backend.model.AssetMetadata;
import com.hyperhook.backend.model.SizeQuantization;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Converts a percentage of withdrawable margin into an order size at the asset's
 * maximum leverage. A zero result means the order would be too small to place.
 */
@Service
@RequiredArgsConstructor
public class PositionSizer {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final TradingProperties tradingProperties;

    public BigDecimal computeSize(BigDecimal withdrawable, int percent, int maxLeverage, BigDecimal price, String asset) {
        return computeSize(withdrawable, percent, maxLeverage, price, quantizationFor(asset));
    }

    public BigDecimal computeSize(BigDecimal withdrawable, int percent, BigDecimal price, AssetMetadata asset) {
        return computeSize(withdrawable, percent, asset.maxLeverage(), price, quantizationFor(asset));
    }

    public BigDecimal computeSize(BigDecimal withdrawable, int percent, int maxLeverage, BigDecimal price,
                                  SizeQuantization quantization) {
        if (price == null || price.signum() <= 0) {
            throw new SizingException("Price must be positive");
        }
        if (withdrawable == null || withdrawable.signum() <= 0) {
            throw new SizingException("Withdrawable balance must be positive");
        }
        if (percent < 1 || percent > 100) {
            throw new SizingException("Percentage must be between 1 and 100, got " + percent);
        }
        if (maxLeverage < 1) {
            throw new SizingException("Leverage must be at least 1, got " + maxLeverage);
        }
        BigDecimal usdAmount = withdrawable.multiply(BigDecimal.valueOf(percent))
                .divide(HUNDRED, MathContext.DECIMAL128);
        BigDecimal rawSize = usdAmount.multiply(BigDecimal.valueOf(maxLeverage))
                .divide(price, MathContext.DECIMAL128);
        return quantize(rawSize, quantization);
    }

    public SizeQuantization quantizationFor(String asset) {
        if (isIntegerAsset(asset)) {
            return SizeQuantization.INTEGER;
        }
        return SizeQuantization.decimal(tradingProperties.getSizeDecimals());
    }

    public SizeQuantization quantizationFor(AssetMetadata asset) {
        if (isIntegerAsset(asset.symbol())) {
            return SizeQuantization.INTEGER;
        }
        return SizeQuantization.decimal(Math.min(tradingProperties.getSizeDecimals(), asset.szDecimals()));
    }

    private boolean isIntegerAsset(String asset) {
        if (asset == null) {
            return false;
        }
        String normalized = asset.trim().toUpperCase(Locale.ROOT);
        return tradingProperties.getIntegerSizeAssets().stream()
                .anyMatch(symbol -> symbol.equalsIgnoreCase(normalized));
    }

    private static BigDecimal quantize(BigDecimal rawSize, SizeQuantization quantization) {
        if (quantization.wholeUnits()) {
            return rawSize.setScale(0, RoundingMode.DOWN);
        }
        return rawSize.setScale(quantization.decimals(), RoundingMode.HALF_EVEN);
    }
}
