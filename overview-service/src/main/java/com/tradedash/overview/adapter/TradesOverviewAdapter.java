package com.tradedash.overview.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradedash.analytics.trade.SideSummary;
import com.tradedash.analytics.trade.TradeSide;
import com.tradedash.analytics.trade.TradeSummary;
import com.tradedash.overview.config.DashboardSettings;
import com.tradedash.overview.exception.PayloadShapeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves {@code /overview/trades} into a {@link TradeSummary}.
 *
 * <h3>Payload</h3>
 * <pre>
 *   {"BUY":  {"count":    {"BTC": {"USDT": "3"}},
 *             "amount":   {"BTC": {"USDT": "0.12"}},
 *             "notional": {"BTC": {"USDT": "7200.5"}},
 *             "fee":      {"BTC": {"USDT": "7.2"}}},
 *    "SELL": {...}}
 * </pre>
 *
 * <p>Only pairs quoted in the configured quote asset are counted. {@code amount}
 * is converted to its current value with the supplied price map; a base asset
 * without a price is left out of the value and flags the side incomplete. Any
 * TOTAL block in the payload is ignored and recomputed.
 */
@Component
public class TradesOverviewAdapter {

    static final String ENDPOINT = "/overview/trades";

    private static final Logger log = LoggerFactory.getLogger(TradesOverviewAdapter.class);

    private final ObjectMapper objectMapper;
    private final String quoteAsset;

    public TradesOverviewAdapter(ObjectMapper objectMapper, DashboardSettings settings) {
        this.objectMapper = objectMapper;
        this.quoteAsset = settings.quoteAsset();
    }

    public TradeSummary resolve(String rawJson, Map<String, BigDecimal> prices) {
        try {
            return resolve(objectMapper.readTree(rawJson), prices);
        } catch (JsonProcessingException e) {
            throw new PayloadShapeException(ENDPOINT, "payload is not valid JSON", e);
        }
    }

    public TradeSummary resolve(JsonNode raw, Map<String, BigDecimal> prices) {
        requireObject(raw);
        TradeSummary summary = TradeSummary.of(
            side(raw.get(TradeSide.BUY.name()), prices),
            side(raw.get(TradeSide.SELL.name()), prices));

        log.debug("TRADES_RESOLVED quote={} buyCount={} sellCount={} incomplete={}",
            quoteAsset, summary.buy().count(), summary.sell().count(), summary.total().amountValueIncomplete());
        return summary;
    }

    /** Base assets traded against any quote, excluding the quote asset itself. */
    public Set<String> assetsIn(JsonNode raw) {
        requireObject(raw);
        Set<String> assets = new TreeSet<>();
        for (TradeSide side : TradeSide.values()) {
            JsonNode amounts = raw.path(side.name()).path("amount");
            amounts.fieldNames().forEachRemaining(assets::add);
        }
        assets.remove(quoteAsset);
        return assets;
    }

    private SideSummary side(JsonNode block, Map<String, BigDecimal> prices) {
        if (block == null || block.isNull()) {
            return SideSummary.EMPTY;
        }
        if (!block.isObject()) {
            throw new PayloadShapeException(ENDPOINT, "side block is not an object: " + block.getNodeType());
        }
        if (block.isEmpty()) {
            return SideSummary.EMPTY;
        }

        BigDecimal count = sum(block, "count");
        BigDecimal notional = sum(block, "notional");
        BigDecimal fee = sum(block, "fee");

        BigDecimal amountValue = BigDecimal.ZERO;
        boolean incomplete = false;
        Iterator<Map.Entry<String, JsonNode>> bases = metric(block, "amount").fields();
        while (bases.hasNext()) {
            Map.Entry<String, JsonNode> base = bases.next();
            BigDecimal amount = quoted(base.getValue(), "amount");
            if (amount == null) {
                continue;
            }
            BigDecimal price = priceOf(base.getKey(), prices);
            if (price == null) {
                incomplete = true;
                continue;
            }
            amountValue = amountValue.add(amount.multiply(price));
        }

        return new SideSummary(toCount(count), notional, fee, amountValue, incomplete);
    }

    private BigDecimal sum(JsonNode block, String metric) {
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode perQuote : metric(block, metric)) {
            BigDecimal value = quoted(perQuote, metric);
            if (value != null) {
                total = total.add(value);
            }
        }
        return total;
    }

    /** Value for the configured quote in a {@code {quote: value}} map, or null if absent. */
    private BigDecimal quoted(JsonNode perQuote, String metric) {
        if (!perQuote.isObject()) {
            throw new PayloadShapeException(ENDPOINT, "'" + metric + "' entries must be {quote: value} maps");
        }
        return JsonDecimals.read(perQuote.get(quoteAsset), ENDPOINT, metric);
    }

    private static JsonNode metric(JsonNode block, String metric) {
        JsonNode node = block.path(metric);
        if (node.isMissingNode() || node.isNull()) {
            return node;
        }
        if (!node.isObject()) {
            throw new PayloadShapeException(ENDPOINT, "'" + metric + "' is not a {base: {quote: value}} map");
        }
        return node;
    }

    private BigDecimal priceOf(String base, Map<String, BigDecimal> prices) {
        if (base.equalsIgnoreCase(quoteAsset)) {
            return BigDecimal.ONE;
        }
        return prices == null ? null : prices.get(base);
    }

    private static long toCount(BigDecimal count) {
        try {
            return count.longValueExact();
        } catch (ArithmeticException e) {
            throw new PayloadShapeException(ENDPOINT, "order count is not a whole number: " + count, e);
        }
    }

    private static void requireObject(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new PayloadShapeException(ENDPOINT, "expected an object, got "
                + (raw == null ? "nothing" : raw.getNodeType()));
        }
    }
}
