package com.hyperhook.backend.exchange.hyperliquid;

import com.hyperhook.backend.config.HyperliquidProperties;
import com.hyperhook.backend.exception.ExchangeApiException;
import com.hyperhook.backend.exception.ExchangeCircuitOpenException;
import com.hyperhook.backend.exception.ExchangeRateLimitException;
import com.hyperhook.backend.exception.ExchangeServerException;
import com.hyperhook.backend.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.function.Supplier;

/**
 * JSON-over-POST transport for the two Hyperliquid endpoints. Every call passes the
 * rate limiter and circuit breaker; only {@code /info} reads are retried.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HyperliquidHttpClient {

    static final String INFO_PATH = "/info";
    static final String EXCHANGE_PATH = "/exchange";

    private final RestTemplate hyperliquidRestTemplate;
    private final CircuitBreaker hyperliquidCircuitBreaker;
    private final RateLimiter hyperliquidRateLimiter;
    private final Retry hyperliquidRetry;
    private final HyperliquidProperties properties;
    private final MetricsService metricsService;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void init() {
        hyperliquidCircuitBreaker.getEventPublisher().onStateTransition(event ->
                log.warn("Hyperliquid circuit breaker {}", event.getStateTransition()));
        Gauge.builder("exchange_circuit_state", hyperliquidCircuitBreaker, breaker -> mapState(breaker.getState()))
                .tag("exchange", "HYPERLIQUID")
                .register(meterRegistry);
    }

    public String postInfo(String body) {
        return execute(INFO_PATH, body, true);
    }

    public String postExchange(String body) {
        return execute(EXCHANGE_PATH, body, false);
    }

    private String execute(String path, String body, boolean retryable) {
        String url = properties.resolveBaseUrl() + path;
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        Supplier<String> decorated = () -> doRequest(url, body);
        try {
            if (retryable) {
                decorated = Retry.decorateSupplier(hyperliquidRetry, decorated);
            }
            decorated = CircuitBreaker.decorateSupplier(hyperliquidCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(hyperliquidRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            recordFailure(path, null, "CIRCUIT_OPEN", e);
            throw new ExchangeCircuitOpenException("Hyperliquid circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            recordFailure(path, null, "RATE_LIMIT", e);
            throw new ExchangeRateLimitException("Hyperliquid client-side rate limit reached", e);
        } catch (ExchangeRateLimitException e) {
            recordFailure(path, 429, "RATE_LIMIT", e);
            throw e;
        } catch (ExchangeApiException e) {
            recordFailure(path, e.getStatusCode(), "HTTP_ERROR", e);
            throw e;
        } catch (ResourceAccessException e) {
            recordFailure(path, null, "NETWORK", e);
            throw new ExchangeApiException("Hyperliquid unreachable: " + e.getMessage(), e);
        } finally {
            sample.stop(Timer.builder("exchange_call_latency")
                    .tag("exchange", "HYPERLIQUID")
                    .tag("endpoint", path)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }

    private String doRequest(String url, String body) {
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<String> entity = new HttpEntity<>(body, headers);
            ResponseEntity<String> response = hyperliquidRestTemplate.exchange(url, HttpMethod.POST, entity, String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Hyperliquid rate limit 429 for {}", url);
            throw new ExchangeRateLimitException("Hyperliquid rate limit", e);
        } catch (HttpServerErrorException e) {
            throw new ExchangeServerException("Hyperliquid server error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.warn("Hyperliquid network error for {}: {}", url, e.getMessage());
            throw e;
        } catch (HttpClientErrorException e) {
            throw new ExchangeApiException("Hyperliquid API error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e.getStatusCode().value(), e);
        }
    }

    private int mapState(CircuitBreaker.State state) {
        return switch (state) {
            case CLOSED -> 0;
            case OPEN -> 1;
            case HALF_OPEN -> 2;
            default -> 3;
        };
    }

    private void recordFailure(String path, Integer status, String reason, Exception e) {
        metricsService.incrementBrokerFailures();
        log.warn("Hyperliquid request failed path={} status={} reason={} message={}",
                path, status, reason, e.getMessage());
    }
}
