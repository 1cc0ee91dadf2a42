package com.hyperhook.backend.config;

import com.hyperhook.backend.exception.ExchangeRateLimitException;
import com.hyperhook.backend.exception.ExchangeServerException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class HyperliquidResilienceConfig {

    @Bean
    public CircuitBreaker hyperliquidCircuitBreaker(HyperliquidProperties properties) {
        HyperliquidProperties.Circuit circuit = properties.getResilience().getCircuit();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(circuit.getFailureRateThreshold())
                .waitDurationInOpenState(Duration.ofSeconds(circuit.getWaitOpenSeconds()))
                .slidingWindowSize(circuit.getSlidingWindowSize())
                .build();
        return CircuitBreaker.of("hyperliquid", config);
    }

    @Bean
    public RateLimiter hyperliquidRateLimiter(HyperliquidProperties properties) {
        HyperliquidProperties.Rate rate = properties.getResilience().getRate();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rate.getLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(rate.getTimeoutMs()))
                .build();
        return RateLimiter.of("hyperliquid", config);
    }

    /**
     * Applied to read-only info requests only; signed exchange actions are never replayed.
     */
    @Bean
    public Retry hyperliquidRetry(HyperliquidProperties properties) {
        HyperliquidProperties.RetrySettings retry = properties.getResilience().getRetry();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(retry.getBaseDelayMs()),
                2.0,
                retry.getJitterFactor()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(ExchangeRateLimitException.class, ResourceAccessException.class, ExchangeServerException.class)
                .build();
        return Retry.of("hyperliquid", config);
    }
}
