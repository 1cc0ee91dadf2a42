package com.hyperhook.backend.exchange;

import com.hyperhook.backend.model.AccountState;
import com.hyperhook.backend.model.AssetMetadata;
import com.hyperhook.backend.model.ExchangeAck;
import com.hyperhook.backend.model.OrderRequest;
import com.hyperhook.backend.model.OrderResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read and write operations against the perpetuals venue. Implementations own
 * transport, signing, timeouts and retries; callers treat every call as a fresh
 * read of remote state.
 */
public interface ExchangeClient {

    /**
     * Address of the trading wallet the client signs for.
     */
    String accountAddress();

    AccountState getAccountState(String address);

    List<AssetMetadata> getAssetMetadata();

    /**
     * Mid prices keyed by the exchange's symbol spelling.
     */
    Map<String, BigDecimal> getMarketPrices();

    /**
     * Mid price for a symbol, trying the exact key first and then a case-insensitive match.
     */
    default Optional<BigDecimal> getMarketPrice(String symbol) {
        Map<String, BigDecimal> prices = getMarketPrices();
        BigDecimal exact = prices.get(symbol);
        if (exact != null) {
            return Optional.of(exact);
        }
        return prices.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(symbol))
                .map(Map.Entry::getValue)
                .findFirst();
    }

    ExchangeAck setLeverage(String symbol, int leverage);

    OrderResult submitMarketOrder(OrderRequest request);

    /**
     * Fully offsets the wallet's position on {@code symbol} with a reduce-only market order.
     */
    OrderResult submitMarketClose(String symbol, BigDecimal slippage);
}
