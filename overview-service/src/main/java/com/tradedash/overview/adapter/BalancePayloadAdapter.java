package com.tradedash.overview.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradedash.overview.config.DashboardSettings;
import com.tradedash.overview.exception.PayloadShapeException;
import com.tradedash.overview.model.BalanceAsset;
import com.tradedash.overview.model.BalanceSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Resolves the {@code /balance} payload into a {@link BalanceSnapshot}.
 *
 * <h3>Accepted shapes</h3>
 * <pre>
 *   1. {"assets":   [{"asset": "BTC", ...}, ...]}
 *   2. {"data":     [...]}
 *   3. {"balances": [...]}
 *   4. [{"asset": "BTC", ...}, ...]
 *   5. {"BTC": {"free": ..., ...}, "ETH": {...}}
 * </pre>
 *
 * <p>Each row needs {@code asset}. A missing {@code total} is derived as
 * {@code free + locked}; a row with neither is rejected. Prices come from the
 * row's own {@code quote_price} when present, else from the supplied price map.
 * The quote asset is always priced at 1.
 */
@Component
public class BalancePayloadAdapter {

    static final String ENDPOINT = "/balance";

    private static final Logger log = LoggerFactory.getLogger(BalancePayloadAdapter.class);

    private static final List<String> LIST_KEYS = List.of("assets", "data", "balances");

    private final ObjectMapper objectMapper;
    private final String quoteAsset;

    public BalancePayloadAdapter(ObjectMapper objectMapper, DashboardSettings settings) {
        this.objectMapper = objectMapper;
        this.quoteAsset = settings.quoteAsset();
    }

    public BalanceSnapshot resolve(String rawJson, Map<String, BigDecimal> prices) {
        try {
            return resolve(objectMapper.readTree(rawJson), prices);
        } catch (JsonProcessingException e) {
            throw new PayloadShapeException(ENDPOINT, "payload is not valid JSON", e);
        }
    }

    public BalanceSnapshot resolve(JsonNode raw, Map<String, BigDecimal> prices) {
        if (isBlank(raw)) {
            return BalanceSnapshot.empty(quoteAsset);
        }

        List<BalanceAsset> assets = new ArrayList<>();
        for (JsonNode row : extractRows(raw)) {
            assets.add(toAsset(row, prices));
        }

        BalanceSnapshot snapshot = BalanceSnapshot.of(quoteAsset, assets);
        log.debug("BALANCE_RESOLVED assets={} equity={} unpriced={}",
            assets.size(), snapshot.equity(), snapshot.hasUnpricedAssets());
        return snapshot;
    }

    /** Asset symbols in the payload, for callers that must look prices up first. */
    public List<String> assetsIn(JsonNode raw) {
        if (isBlank(raw)) {
            return List.of();
        }
        List<String> symbols = new ArrayList<>();
        for (JsonNode row : extractRows(raw)) {
            symbols.add(requireAsset(row));
        }
        return symbols;
    }

    private List<JsonNode> extractRows(JsonNode raw) {
        if (raw.isArray()) {
            return toList(raw);
        }
        if (raw.isObject()) {
            for (String key : LIST_KEYS) {
                JsonNode nested = raw.get(key);
                if (nested != null && nested.isArray()) {
                    return toList(nested);
                }
            }
            if (allValuesAreObjects(raw)) {
                List<JsonNode> rows = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> fields = raw.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> entry = fields.next();
                    rows.add(objectMapper.createObjectNode()
                        .put("asset", entry.getKey())
                        .setAll((ObjectNode) entry.getValue()));
                }
                return rows;
            }
        }
        throw new PayloadShapeException(ENDPOINT, "unrecognised payload shape: " + raw.getNodeType());
    }

    private BalanceAsset toAsset(JsonNode row, Map<String, BigDecimal> prices) {
        String asset = requireAsset(row);
        BigDecimal free = JsonDecimals.read(row.get("free"), ENDPOINT, "free");
        BigDecimal locked = JsonDecimals.read(row.get("locked"), ENDPOINT, "locked");
        BigDecimal used = JsonDecimals.read(row.get("used"), ENDPOINT, "used");
        BigDecimal total = JsonDecimals.read(row.get("total"), ENDPOINT, "total");

        if (used == null) {
            used = locked;
        }
        if (total == null) {
            if (free == null) {
                throw new PayloadShapeException(ENDPOINT, "neither 'total' nor 'free' present for asset " + asset);
            }
            total = free.add(locked != null ? locked : BigDecimal.ZERO);
        }

        return new BalanceAsset(asset, free, used, total, priceOf(asset, row, prices));
    }

    private BigDecimal priceOf(String asset, JsonNode row, Map<String, BigDecimal> prices) {
        BigDecimal own = JsonDecimals.read(row.get("quote_price"), ENDPOINT, "quote_price");
        if (own != null) {
            return own;
        }
        if (asset.equalsIgnoreCase(quoteAsset)) {
            return BigDecimal.ONE;
        }
        return prices == null ? null : prices.get(asset);
    }

    private static String requireAsset(JsonNode row) {
        JsonNode asset = row.get("asset");
        if (asset == null || !asset.isTextual() || asset.asText().isBlank()) {
            throw new PayloadShapeException(ENDPOINT, "row lacks an 'asset' column: " + row);
        }
        return asset.asText();
    }

    private static boolean isBlank(JsonNode raw) {
        return raw == null || raw.isNull() || raw.isMissingNode() || (raw.isContainerNode() && raw.isEmpty());
    }

    private static boolean allValuesAreObjects(JsonNode raw) {
        Iterator<JsonNode> values = raw.elements();
        while (values.hasNext()) {
            if (!values.next().isObject()) {
                return false;
            }
        }
        return true;
    }

    private static List<JsonNode> toList(JsonNode array) {
        List<JsonNode> rows = new ArrayList<>(array.size());
        array.forEach(rows::add);
        return rows;
    }
}
