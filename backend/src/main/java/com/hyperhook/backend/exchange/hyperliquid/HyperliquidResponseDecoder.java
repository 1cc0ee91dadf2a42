package com.hyperhook.backend.exchange.hyperliquid;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hyperhook.backend.exception.ExchangeApiException;
import com.hyperhook.backend.model.AccountState;
import com.hyperhook.backend.model.AssetMetadata;
import com.hyperhook.backend.model.ExchangeAck;
import com.hyperhook.backend.model.OrderResult;
import com.hyperhook.backend.model.Position;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw Hyperliquid JSON into domain values. Nothing outside this class looks at
 * the exchange's response shapes.
 */
@Component
@RequiredArgsConstructor
public class HyperliquidResponseDecoder {

    private final ObjectMapper objectMapper;

    public AccountState decodeAccountState(String address, String json) {
        JsonNode root = read(json);
        BigDecimal withdrawable = decimal(root.path("withdrawable"));
        List<Position> positions = new ArrayList<>();
        for (JsonNode entry : root.path("assetPositions")) {
            JsonNode position = entry.path("position");
            String coin = position.path("coin").asText(null);
            if (coin == null) {
                continue;
            }
            positions.add(new Position(coin, decimal(position.path("szi"))));
        }
        return new AccountState(address, withdrawable, positions);
    }

    public List<AssetMetadata> decodeMeta(String json) {
        JsonNode universe = read(json).path("universe");
        List<AssetMetadata> assets = new ArrayList<>();
        int index = 0;
        for (JsonNode asset : universe) {
            assets.add(new AssetMetadata(
                    asset.path("name").asText(),
                    asset.path("maxLeverage").asInt(1),
                    asset.path("szDecimals").asInt(0),
                    index++));
        }
        return assets;
    }

    public Map<String, BigDecimal> decodeMids(String json) {
        JsonNode root = read(json);
        Map<String, BigDecimal> mids = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            BigDecimal price = decimal(field.getValue());
            if (price != null) {
                mids.put(field.getKey(), price);
            }
        }
        return mids;
    }

    /**
     * Success needs a top-level {@code "ok"} and no per-order {@code error} entry; the
     * exchange reports rejected orders inside an otherwise successful envelope.
     */
    public OrderResult decodeOrder(String json) {
        JsonNode root = read(json);
        if (!isOkStatus(root)) {
            return OrderResult.error(topLevelDetail(root, json), json);
        }
        JsonNode statuses = root.path("response").path("data").path("statuses");
        List<String> errors = new ArrayList<>();
        for (JsonNode status : statuses) {
            if (status.has("error")) {
                errors.add(status.path("error").asText());
            }
        }
        if (!errors.isEmpty()) {
            return OrderResult.error(String.join("; ", errors), json);
        }
        for (JsonNode status : statuses) {
            JsonNode filled = status.path("filled");
            if (filled.isObject()) {
                return OrderResult.ok(
                        textOrNull(filled.path("totalSz")),
                        textOrNull(filled.path("avgPx")),
                        textOrNull(filled.path("oid")),
                        json);
            }
            JsonNode resting = status.path("resting");
            if (resting.isObject()) {
                return OrderResult.ok(null, null, textOrNull(resting.path("oid")), json);
            }
        }
        return OrderResult.ok(null, null, null, json);
    }

    public ExchangeAck decodeAck(String json) {
        JsonNode root = read(json);
        if (isOkStatus(root)) {
            return ExchangeAck.success(json);
        }
        return ExchangeAck.failure(topLevelDetail(root, json));
    }

    private boolean isOkStatus(JsonNode root) {
        return "ok".equals(root.path("status").asText());
    }

    private String topLevelDetail(JsonNode root, String json) {
        JsonNode response = root.path("response");
        if (response.isTextual()) {
            return response.asText();
        }
        return json;
    }

    private JsonNode read(String json) {
        if (json == null || json.isBlank()) {
            throw new ExchangeApiException("Empty response from Hyperliquid");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ExchangeApiException("Unreadable response from Hyperliquid", e);
        }
    }

    private static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        try {
            return new BigDecimal(node.asText());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String textOrNull(JsonNode node) {
        return node.isMissingNode() || node.isNull() ? null : node.asText();
    }
}
