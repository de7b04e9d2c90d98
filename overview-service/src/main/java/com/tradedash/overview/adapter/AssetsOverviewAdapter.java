package com.tradedash.overview.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradedash.analytics.reconcile.MetricSet;
import com.tradedash.overview.config.DashboardSettings;
import com.tradedash.overview.exception.PayloadShapeException;
import com.tradedash.overview.model.AssetsOverview;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves {@code /overview/assets}:
 * <pre>
 *   {"balance_source": {"total_equity": ..., ...},
 *    "orders_source":  {"total_frozen_value": ..., ...},
 *    "misc":           {"cash_asset": "USDT"}}
 * </pre>
 * Both source blocks are required. Nested objects, booleans and nulls inside a
 * block are skipped; a string that is not a number is rejected.
 * A missing {@code misc.cash_asset} falls back to the configured quote asset.
 */
@Component
public class AssetsOverviewAdapter {

    static final String ENDPOINT = "/overview/assets";

    public static final String BALANCE_SOURCE = "balance_source";
    public static final String ORDERS_SOURCE = "orders_source";

    private final ObjectMapper objectMapper;
    private final String quoteAsset;

    public AssetsOverviewAdapter(ObjectMapper objectMapper, DashboardSettings settings) {
        this.objectMapper = objectMapper;
        this.quoteAsset = settings.quoteAsset();
    }

    public AssetsOverview resolve(String rawJson) {
        try {
            return resolve(objectMapper.readTree(rawJson));
        } catch (JsonProcessingException e) {
            throw new PayloadShapeException(ENDPOINT, "payload is not valid JSON", e);
        }
    }

    public AssetsOverview resolve(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new PayloadShapeException(ENDPOINT, "expected an object, got "
                + (raw == null ? "nothing" : raw.getNodeType()));
        }
        String cashAsset = raw.path("misc").path("cash_asset").asText("");
        return new AssetsOverview(
            cashAsset.isBlank() ? quoteAsset : cashAsset,
            metricSet(raw, BALANCE_SOURCE),
            metricSet(raw, ORDERS_SOURCE));
    }

    private static MetricSet metricSet(JsonNode raw, String source) {
        JsonNode block = raw.get(source);
        if (block == null || !block.isObject()) {
            throw new PayloadShapeException(ENDPOINT, "missing '" + source + "' block");
        }
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = block.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isNumber() || field.getValue().isTextual()) {
                BigDecimal value = JsonDecimals.read(field.getValue(), ENDPOINT, field.getKey());
                if (value != null) {
                    values.put(field.getKey(), value);
                }
            }
        }
        return new MetricSet(source, values);
    }
}
