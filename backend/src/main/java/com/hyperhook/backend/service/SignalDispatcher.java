package com.hyperhook.backend.service;

import com.hyperhook.backend.config.TradingProperties;
import com.hyperhook.backend.dto.ResponseEnvelope;
import com.hyperhook.backend.dto.TradeSignal;
import com.hyperhook.backend.model.ErrorType;
import com.hyperhook.backend.model.PositionSide;
import com.hyperhook.backend.model.TradeAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;

/**
 * Routes an authenticated signal to the matching position operation. This is the one
 * place where adapter exceptions are turned into error envelopes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalDispatcher {

    private final PositionManager positionManager;
    private final TradingProperties tradingProperties;
    private final MetricsService metricsService;

    public ResponseEnvelope dispatch(TradeSignal signal) {
        metricsService.recordSignalReceived(signal.getAction());
        ResponseEnvelope response = route(signal);
        metricsService.recordOutcome(response.getStatus());
        return response;
    }

    private ResponseEnvelope route(TradeSignal signal) {
        Optional<TradeAction> action = TradeAction.from(signal.getAction());
        if (action.isEmpty()) {
            String raw = signal.getAction() == null ? "" : signal.getAction().toLowerCase(Locale.ROOT);
            log.error("Unknown action: {}", raw);
            return ResponseEnvelope.error(ErrorType.VALIDATION, "Unknown action: " + raw);
        }

        Integer percent = parsePercent(signal.getAmountPercent());
        if (percent == null) {
            return ResponseEnvelope.error(ErrorType.VALIDATION,
                    "Invalid amountPercent: " + signal.getAmountPercent());
        }

        log.info("Processing action: {} for {} with {}% of balance",
                action.get().name().toLowerCase(Locale.ROOT), signal.getTicker(), percent);

        return switch (action.get()) {
            case LONG -> open(signal.getTicker(), PositionSide.LONG, percent);
            case SHORT -> open(signal.getTicker(), PositionSide.SHORT, percent);
            case CLOSE -> closeAll();
        };
    }

    private ResponseEnvelope open(String ticker, PositionSide side, int percent) {
        try {
            return positionManager.openPosition(ticker, side, percent);
        } catch (RuntimeException e) {
            metricsService.incrementBrokerFailures();
            log.error("Error opening position: {}", e.getMessage(), e);
            return ResponseEnvelope.error(ErrorType.EXCHANGE, "Error opening position: " + e.getMessage());
        }
    }

    private ResponseEnvelope closeAll() {
        try {
            return positionManager.closeAllPositions();
        } catch (RuntimeException e) {
            metricsService.incrementBrokerFailures();
            log.error("Error closing all positions: {}", e.getMessage(), e);
            return ResponseEnvelope.error(ErrorType.EXCHANGE, "Error closing all positions: " + e.getMessage());
        }
    }

    /**
     * Accepts an integer or an integral numeric string; missing means the configured default.
     */
    Integer parsePercent(String raw) {
        if (raw == null || raw.isBlank()) {
            return tradingProperties.getDefaultAmountPercent();
        }
        try {
            return new BigDecimal(raw.trim()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            log.warn("Rejected amountPercent '{}'", raw);
            return null;
        }
    }
}
