package com.hyperhook.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Exchange connection settings. The private key and network flag are normally
 * supplied through {@code HYPERLIQUID_PRIVATE_KEY} and {@code HYPERLIQUID_USE_MAINNET}.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "hyperliquid")
public class HyperliquidProperties {

    public static final String MAINNET_API_URL = "https://api.hyperliquid.xyz";
    public static final String TESTNET_API_URL = "https://api.hyperliquid-testnet.xyz";

    private String privateKey;

    private boolean useMainnet = true;

    /**
     * Overrides the network default, mostly for tests and self-hosted proxies.
     */
    private String baseUrl;

    private Http http = new Http();

    private Resilience resilience = new Resilience();

    public String resolveBaseUrl() {
        if (baseUrl != null && !baseUrl.isBlank()) {
            return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        }
        return useMainnet ? MAINNET_API_URL : TESTNET_API_URL;
    }

    public boolean hasPrivateKey() {
        return privateKey != null && !privateKey.isBlank();
    }

    @Data
    public static class Http {
        @Positive
        private int connectTimeoutMs = 10000;

        @Positive
        private int readTimeoutMs = 10000;
    }

    @Data
    public static class Resilience {
        private Circuit circuit = new Circuit();
        private Rate rate = new Rate();
        private RetrySettings retry = new RetrySettings();
    }

    @Data
    public static class Circuit {
        @Positive
        private float failureRateThreshold = 50;

        @Positive
        private long waitOpenSeconds = 30;

        @Min(1)
        private int slidingWindowSize = 20;
    }

    @Data
    public static class Rate {
        @Min(1)
        private int limitPerSecond = 10;

        @Min(0)
        private long timeoutMs = 500;
    }

    @Data
    public static class RetrySettings {
        @Min(1)
        private int maxAttempts = 3;

        @Positive
        private long baseDelayMs = 300;

        @Positive
        private double jitterFactor = 0.2;
    }
}
