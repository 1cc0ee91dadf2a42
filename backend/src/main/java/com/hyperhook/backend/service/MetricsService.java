package com.hyperhook.backend.service;

import com.hyperhook.backend.dto.EnvelopeStatus;
import com.hyperhook.backend.model.TradeAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter ordersPlacedCounter;
    private Counter ordersFilledCounter;
    private Counter brokerErrorsCounter;
    private Counter leverageWarningsCounter;

    @jakarta.annotation.PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        ordersFilledCounter = Counter.builder("orders_filled_total").register(meterRegistry);
        brokerErrorsCounter = Counter.builder("broker_errors_total").register(meterRegistry);
        leverageWarningsCounter = Counter.builder("leverage_update_warnings_total").register(meterRegistry);
    }

    // Tagged by known action only, so arbitrary payloads cannot create new series.
    public void recordSignalReceived(String action) {
        String tag = TradeAction.from(action)
                .map(known -> known.name().toLowerCase(Locale.ROOT))
                .orElse("unknown");
        Counter.builder("signals_received_total")
                .tag("action", tag)
                .register(meterRegistry)
                .increment();
    }

    public void recordOutcome(EnvelopeStatus status) {
        Counter.builder("signal_outcomes_total")
                .tag("status", status == null ? "unknown" : status.wireName())
                .register(meterRegistry)
                .increment();
    }

    public void incrementOrdersPlaced() {
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void recordOrderFilled() {
        if (ordersFilledCounter != null) {
            ordersFilledCounter.increment();
        }
    }

    public void incrementBrokerFailures() {
        if (brokerErrorsCounter != null) {
            brokerErrorsCounter.increment();
        }
    }

    public void recordLeverageWarning() {
        if (leverageWarningsCounter != null) {
            leverageWarningsCounter.increment();
        }
    }
}
