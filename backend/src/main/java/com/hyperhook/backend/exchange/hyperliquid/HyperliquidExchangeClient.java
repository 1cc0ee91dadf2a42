package com.hyperhook.backend.exchange.hyperliquid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperhook.backend.config.HyperliquidProperties;
import com.hyperhook.backend.exception.WalletNotConfiguredException;
import com.hyperhook.backend.exchange.ExchangeClient;
import com.hyperhook.backend.model.AccountState;
import com.hyperhook.backend.model.AssetMetadata;
import com.hyperhook.backend.model.ExchangeAck;
import com.hyperhook.backend.model.OrderRequest;
import com.hyperhook.backend.model.OrderResult;
import com.hyperhook.backend.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

@Slf4j
@Service
public class HyperliquidExchangeClient implements ExchangeClient {

    private final HyperliquidHttpClient httpClient;
    private final HyperliquidResponseDecoder decoder;
    private final ObjectMapper objectMapper;
    private final HyperliquidSigner signer;
    private final AtomicLong lastNonce = new AtomicLong();

    public HyperliquidExchangeClient(HyperliquidHttpClient httpClient,
                                     HyperliquidResponseDecoder decoder,
                                     HyperliquidProperties properties,
                                     ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.decoder = decoder;
        this.objectMapper = objectMapper;
        if (properties.hasPrivateKey()) {
            try {
                this.signer = new HyperliquidSigner(properties.getPrivateKey(), properties.isUseMainnet());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("hyperliquid.private-key is invalid: " + e.getMessage(), e);
            }
            log.info("Hyperliquid wallet {} on {}", signer.address(), properties.isUseMainnet() ? "mainnet" : "testnet");
        } else {
            this.signer = null;
        }
    }

    @Override
    public String accountAddress() {
        return signer().address();
    }

    @Override
    public AccountState getAccountState(String address) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("type", "clearinghouseState");
        request.put("user", address);
        return decoder.decodeAccountState(address, httpClient.postInfo(toJson(request)));
    }

    @Override
    public List<AssetMetadata> getAssetMetadata() {
        return decoder.decodeMeta(httpClient.postInfo(toJson(Map.of("type", "meta"))));
    }

    @Override
    public Map<String, BigDecimal> getMarketPrices() {
        return decoder.decodeMids(httpClient.postInfo(toJson(Map.of("type", "allMids"))));
    }

    @Override
    public ExchangeAck setLeverage(String symbol, int leverage) {
        Optional<AssetMetadata> asset = findAsset(symbol);
        if (asset.isEmpty()) {
            return ExchangeAck.failure("Unknown asset " + symbol);
        }
        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "updateLeverage");
        action.put("asset", asset.get().universeIndex());
        action.put("isCross", true);
        action.put("leverage", leverage);
        return decoder.decodeAck(postAction(action));
    }

    @Override
    public OrderResult submitMarketOrder(OrderRequest request) {
        Optional<AssetMetadata> asset = findAsset(request.asset());
        if (asset.isEmpty()) {
            return OrderResult.error("Unknown asset " + request.asset(), null);
        }
        Optional<BigDecimal> mid = getMarketPrice(asset.get().symbol());
        if (mid.isEmpty() || mid.get().signum() <= 0) {
            return OrderResult.error("No mid price for " + request.asset(), null);
        }
        BigDecimal slippage = request.slippageTolerance() == null
                ? OrderRequest.DEFAULT_SLIPPAGE
                : request.slippageTolerance();
        BigDecimal limitPrice = WireFormat.slippagePrice(mid.get(), request.isBuy(), slippage, asset.get().szDecimals());
        log.info("Submitting {} {} {} @ {} (mid {}, reduceOnly={})",
                request.isBuy() ? "BUY" : "SELL", request.size().toPlainString(), asset.get().symbol(),
                limitPrice.toPlainString(), mid.get().toPlainString(), request.reduceOnly());
        Map<String, Object> action = orderAction(asset.get().universeIndex(), request.isBuy(),
                limitPrice, request.size(), request.reduceOnly());
        return decoder.decodeOrder(postAction(action));
    }

    @Override
    public OrderResult submitMarketClose(String symbol, BigDecimal slippage) {
        AccountState state = getAccountState(accountAddress());
        Optional<Position> position = state.openPosition(symbol);
        if (position.isEmpty()) {
            return OrderResult.error("No open position for " + symbol, null);
        }
        Position open = position.get();
        boolean isBuy = open.signedSize().signum() < 0;
        return submitMarketOrder(new OrderRequest(symbol, isBuy, open.absoluteSize(), slippage, true));
    }

    long nextNonce() {
        long now = System.currentTimeMillis();
        return lastNonce.updateAndGet(previous -> Math.max(previous + 1, now));
    }

    private Map<String, Object> orderAction(int assetIndex, boolean isBuy, BigDecimal price,
                                            BigDecimal size, boolean reduceOnly) {
        Map<String, Object> order = new LinkedHashMap<>();
        order.put("a", assetIndex);
        order.put("b", isBuy);
        order.put("p", WireFormat.floatToWire(price));
        order.put("s", WireFormat.floatToWire(size));
        order.put("r", reduceOnly);
        order.put("t", Map.of("limit", Map.of("tif", "Ioc")));

        Map<String, Object> action = new LinkedHashMap<>();
        action.put("type", "order");
        action.put("orders", List.of(order));
        action.put("grouping", "na");
        return action;
    }

    private String postAction(Map<String, Object> action) {
        HyperliquidSigner wallet = signer();
        long nonce = nextNonce();
        HyperliquidSigner.Signature signature = wallet.signL1Action(action, nonce);

        Map<String, Object> sig = new LinkedHashMap<>();
        sig.put("r", signature.r());
        sig.put("s", signature.s());
        sig.put("v", signature.v());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        payload.put("nonce", nonce);
        payload.put("signature", sig);
        payload.put("vaultAddress", null);
        return httpClient.postExchange(toJson(payload));
    }

    private Optional<AssetMetadata> findAsset(String symbol) {
        List<AssetMetadata> universe = getAssetMetadata();
        Optional<AssetMetadata> exact = universe.stream()
                .filter(asset -> asset.symbol().equals(symbol))
                .findFirst();
        if (exact.isPresent()) {
            return exact;
        }
        return universe.stream()
                .filter(asset -> asset.symbol().equalsIgnoreCase(symbol))
                .findFirst();
    }

    private HyperliquidSigner signer() {
        if (signer == null) {
            throw new WalletNotConfiguredException("HYPERLIQUID_PRIVATE_KEY is not configured");
        }
        return signer;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Hyperliquid request", e);
        }
    }
}
