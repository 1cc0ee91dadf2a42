package com.hyperhook.backend.service;

import com.hyperhook.backend.config.TradingProperties;
import com.hyperhook.backend.dto.EnvelopeStatus;
import com.hyperhook.backend.dto.FillDetails;
import com.hyperhook.backend.dto.OpenPositionDetails;
import com.hyperhook.backend.dto.PositionItem;
import com.hyperhook.backend.dto.ResponseEnvelope;
import com.hyperhook.backend.exchange.ExchangeClient;
import com.hyperhook.backend.model.AccountState;
import com.hyperhook.backend.model.AssetMetadata;
import com.hyperhook.backend.model.ErrorType;
import com.hyperhook.backend.model.ExchangeAck;
import com.hyperhook.backend.model.OrderRequest;
import com.hyperhook.backend.model.OrderResult;
import com.hyperhook.backend.model.Position;
import com.hyperhook.backend.model.PositionSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Opens, flips and closes perpetual positions. Every operation reads account state
 * fresh from the exchange and reports its outcome as a {@link ResponseEnvelope};
 * only unexpected adapter faults escape as exceptions.
 */
@Slf4j
@Service
public class PositionManager {

    private final ExchangeClient exchangeClient;
    private final PositionSizer positionSizer;
    private final TradingProperties tradingProperties;
    private final MetricsService metricsService;
    private final Executor tradingExecutor;

    public PositionManager(ExchangeClient exchangeClient,
                           PositionSizer positionSizer,
                           TradingProperties tradingProperties,
                           MetricsService metricsService,
                           @Qualifier("tradingExecutor") Executor tradingExecutor) {
        this.exchangeClient = exchangeClient;
        this.positionSizer = positionSizer;
        this.tradingProperties = tradingProperties;
        this.metricsService = metricsService;
        this.tradingExecutor = tradingExecutor;
    }

    public ResponseEnvelope openPosition(String ticker, PositionSide side, int percent) {
        if (percent < 1 || percent > 100) {
            return validationError("Percentage must be between 1 and 100, got " + percent);
        }
        log.info("Opening {} position for {} with {}% of balance", side.wireName(), ticker, percent);

        String address = exchangeClient.accountAddress();
        Optional<AssetMetadata> resolved = resolveAsset(ticker);
        if (resolved.isEmpty()) {
            return validationError("Asset " + ticker + " not found");
        }
        AssetMetadata asset = resolved.get();
        String symbol = asset.symbol();
        if (asset.maxLeverage() < 1) {
            return validationError("Invalid max leverage " + asset.maxLeverage() + " for " + symbol);
        }

        AccountState account = exchangeClient.getAccountState(address);
        BigDecimal withdrawable = account.withdrawableBalance();
        if (withdrawable.signum() <= 0) {
            return validationError("Insufficient balance: no USDC available for trading");
        }

        Optional<BigDecimal> mid = exchangeClient.getMarketPrice(symbol);
        if (mid.isEmpty()) {
            return validationError("Could not get current price for " + symbol);
        }
        BigDecimal price = mid.get();
        if (price.signum() <= 0) {
            return validationError("Invalid price (0 or negative) for " + symbol);
        }

        BigDecimal size = positionSizer.computeSize(withdrawable, percent, price, asset);
        if (size.signum() <= 0) {
            return validationError("Calculated position size too small. Try increasing the percentage.");
        }

        updateLeverage(symbol, asset.maxLeverage());

        PositionItem closedOpposite = null;
        Optional<Position> existing = exchangeClient.getAccountState(address).openPosition(symbol);
        if (existing.isPresent() && existing.get().side() == side.opposite()) {
            log.info("Found existing {} {} position, closing it before opening {}",
                    symbol, existing.get().side().wireName(), side.wireName());
            ResponseEnvelope closeResult = closePosition(symbol);
            if (!closeResult.isSuccess()) {
                log.error("Failed to close opposite position: {}", closeResult.getMessage());
                return closeResult;
            }
            closedOpposite = PositionItem.closed(symbol, plain(existing.get().absoluteSize()),
                    existing.get().side().wireName());
            BigDecimal refreshed = exchangeClient.getAccountState(address).withdrawableBalance();
            if (refreshed.signum() <= 0) {
                return afterClose(validationError("Insufficient balance after closing opposite position."), closedOpposite);
            }
            size = positionSizer.computeSize(refreshed, percent, price, asset);
            if (size.signum() <= 0) {
                return afterClose(validationError("Calculated position size too small after closing opposite position."),
                        closedOpposite);
            }
        }

        OrderRequest request = OrderRequest.marketOpen(symbol, side.isBuy(), size, tradingProperties.getSlippage());
        log.info("Placing {} order for {} {}", side.isBuy() ? "buy" : "sell", plain(size), symbol);
        OrderResult result = exchangeClient.submitMarketOrder(request);
        metricsService.incrementOrdersPlaced();

        if (!result.isOk()) {
            log.error("Order failed with error: {}", result.errorDetail());
            return afterClose(ResponseEnvelope.error(ErrorType.EXCHANGE, "Failed to open position: " + result.errorDetail()),
                    closedOpposite);
        }

        ResponseEnvelope envelope = ResponseEnvelope.success("Successfully opened " + side.wireName() + " position for " + symbol);
        envelope.setDetails(new OpenPositionDetails(
                symbol,
                side.wireName(),
                plain(size),
                asset.maxLeverage(),
                plain(size.multiply(price))));
        if (result.hasFill()) {
            metricsService.recordOrderFilled();
            envelope.setFilled(new FillDetails(result.filledSize(), result.avgPrice(), result.orderId()));
        }
        return envelope;
    }

    public ResponseEnvelope closePosition(String asset) {
        AccountState account = exchangeClient.getAccountState(exchangeClient.accountAddress());
        Optional<Position> position = account.openPosition(asset);
        if (position.isEmpty()) {
            log.info("No open position found for {} to close", asset);
            return ResponseEnvelope.success("No open position found for " + asset + " to close");
        }
        log.info("Closing {} position of size {}", asset, plain(position.get().absoluteSize()));
        OrderResult result = exchangeClient.submitMarketClose(asset, tradingProperties.getSlippage());
        metricsService.incrementOrdersPlaced();
        if (result.isOk()) {
            log.info("Successfully closed {} position", asset);
            return ResponseEnvelope.success("Successfully closed " + asset + " position");
        }
        log.error("Failed to close {} position: {}", asset, result.errorDetail());
        return ResponseEnvelope.error(ErrorType.EXCHANGE, "Failed to close " + asset + " position",
                Map.of("error", String.valueOf(result.errorDetail())));
    }

    public ResponseEnvelope closeAllPositions() {
        AccountState account = exchangeClient.getAccountState(exchangeClient.accountAddress());
        List<Position> open = account.openPositions();
        if (open.isEmpty()) {
            log.info("No open positions to close");
            ResponseEnvelope envelope = ResponseEnvelope.success("No open positions to close");
            envelope.setClosedPositions(List.of());
            envelope.setFailedPositions(List.of());
            return envelope;
        }
        log.info("Closing {} positions...", open.size());

        List<PositionItem> outcomes = tradingProperties.isParallelClose()
                ? closeInParallel(open)
                : open.stream().map(this::closeOne).toList();

        List<PositionItem> closed = new ArrayList<>();
        List<PositionItem> failed = new ArrayList<>();
        for (PositionItem item : outcomes) {
            if (item.error() == null) {
                closed.add(item);
            } else {
                failed.add(item);
            }
        }

        String message = "Closed " + closed.size() + " positions"
                + (failed.isEmpty() ? "" : ", " + failed.size() + " failed");
        ResponseEnvelope.ResponseEnvelopeBuilder builder = ResponseEnvelope.builder()
                .message(message)
                .closedPositions(closed)
                .failedPositions(failed);
        if (failed.isEmpty()) {
            builder.status(EnvelopeStatus.SUCCESS);
        } else if (closed.isEmpty()) {
            builder.status(EnvelopeStatus.ERROR).errorType(ErrorType.EXCHANGE);
        } else {
            builder.status(EnvelopeStatus.PARTIAL).errorType(ErrorType.PARTIAL);
        }
        return builder.build();
    }

    private List<PositionItem> closeInParallel(List<Position> positions) {
        List<CompletableFuture<PositionItem>> futures = positions.stream()
                .map(this::submitClose)
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CompletableFuture<PositionItem> submitClose(Position position) {
        try {
            return CompletableFuture.supplyAsync(() -> closeOne(position), tradingExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Trading executor saturated, closing {} on the calling thread", position.asset());
            return CompletableFuture.completedFuture(closeOne(position));
        }
    }

    private PositionItem closeOne(Position position) {
        String asset = position.asset();
        String size = plain(position.absoluteSize());
        String side = position.side().wireName();
        try {
            OrderResult result = exchangeClient.submitMarketClose(asset, tradingProperties.getSlippage());
            metricsService.incrementOrdersPlaced();
            if (result.isOk()) {
                log.info("Closed {} position", asset);
                return PositionItem.closed(asset, size, side);
            }
            log.error("Failed to close {} position: {}", asset, result.errorDetail());
            return PositionItem.failed(asset, size, side, String.valueOf(result.errorDetail()));
        } catch (RuntimeException e) {
            log.error("Error closing {} position: {}", asset, e.getMessage(), e);
            return PositionItem.failed(asset, size, side, e.getMessage());
        }
    }

    private void updateLeverage(String symbol, int leverage) {
        try {
            ExchangeAck ack = exchangeClient.setLeverage(symbol, leverage);
            if (ack.ok()) {
                log.debug("Set leverage for {} to {}x", symbol, leverage);
            } else {
                metricsService.recordLeverageWarning();
                log.warn("Failed to set leverage for {}: {}", symbol, ack.detail());
            }
        } catch (RuntimeException e) {
            metricsService.recordLeverageWarning();
            log.warn("Failed to set leverage for {}: {}", symbol, e.getMessage());
        }
    }

    private Optional<AssetMetadata> resolveAsset(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            return Optional.empty();
        }
        List<AssetMetadata> universe = exchangeClient.getAssetMetadata();
        String upper = ticker.trim().toUpperCase(Locale.ROOT);
        Optional<AssetMetadata> exact = universe.stream()
                .filter(asset -> asset.symbol().equals(upper))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return universe.stream()
                .filter(asset -> asset.symbol().equalsIgnoreCase(ticker.trim()))
                .findFirst();
    }

    /**
     * Records on a failed open that the opposite position was already closed.
     */
    private static ResponseEnvelope afterClose(ResponseEnvelope failure, PositionItem closedOpposite) {
        if (closedOpposite != null) {
            failure.setDetails(Map.of("closed_opposite_position", closedOpposite));
        }
        return failure;
    }

    private static ResponseEnvelope validationError(String message) {
        log.error(message);
        return ResponseEnvelope.error(ErrorType.VALIDATION, message);
    }

    private static String plain(BigDecimal value) {
        if (value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }
}
