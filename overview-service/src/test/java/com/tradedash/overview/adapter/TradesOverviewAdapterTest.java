package com.tradedash.overview.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradedash.analytics.trade.SideSummary;
import com.tradedash.analytics.trade.TradeSummary;
import com.tradedash.overview.config.DashboardConfig;
import com.tradedash.overview.config.DashboardSettings;
import com.tradedash.overview.exception.PayloadShapeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TradesOverviewAdapterTest {

    static final String PAYLOAD = """
        {"BUY":  {"count":    {"BTC": {"USDT": "2"},     "ETH": {"USDT": "1", "BUSD": "5"}},
                  "amount":   {"BTC": {"USDT": "0.1"},   "ETH": {"USDT": "2"}},
                  "notional": {"BTC": {"USDT": "6000"},  "ETH": {"USDT": "4000", "BUSD": "999"}},
                  "fee":      {"BTC": {"USDT": "6"},     "ETH": {"USDT": "4"}}},
         "SELL": {"count":    {"BTC": {"USDT": "1"}},
                  "amount":   {"BTC": {"USDT": "0.05"}},
                  "notional": {"BTC": {"USDT": "3500"}},
                  "fee":      {"BTC": {"USDT": "3.5"}}},
         "TOTAL": {"count": {"BTC": {"USDT": "999"}}}}
        """;

    static final Map<String, BigDecimal> PRICES = Map.of(
        "BTC", new BigDecimal("70000"),
        "ETH", new BigDecimal("2500"));

    private final ObjectMapper mapper = new DashboardConfig().objectMapper();
    private final TradesOverviewAdapter adapter = new TradesOverviewAdapter(mapper,
        new DashboardSettings("USDT", Duration.ofSeconds(300), 12, ZoneId.of("UTC")));

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("sums quote-asset pairs only and values amounts at current prices")
    void resolvesBothSides() throws Exception {
        TradeSummary summary = adapter.resolve(json(PAYLOAD), PRICES);

        assertEquals(3, summary.buy().count());
        assertDecimal("10000", summary.buy().notional());
        assertDecimal("10", summary.buy().fee());
        // 0.1 × 70000 + 2 × 2500
        assertDecimal("12000", summary.buy().amountValue());
        assertFalse(summary.buy().amountValueIncomplete());

        assertEquals(1, summary.sell().count());
        assertDecimal("3500", summary.sell().amountValue());
    }

    @Test
    @DisplayName("payload TOTAL ignored; TOTAL = BUY + SELL")
    void totalRecomputed() throws Exception {
        TradeSummary summary = adapter.resolve(json(PAYLOAD), PRICES);
        assertEquals(4, summary.total().count());
        assertDecimal("13500", summary.total().notional());
        assertDecimal("13.5", summary.total().fee());
        assertDecimal("15500", summary.total().amountValue());
    }

    @Test
    @DisplayName("missing price → that side incomplete, value excludes the asset")
    void missingPrice() throws Exception {
        TradeSummary summary = adapter.resolve(json(PAYLOAD), Map.of("BTC", new BigDecimal("70000")));
        assertDecimal("7000", summary.buy().amountValue());
        assertTrue(summary.buy().amountValueIncomplete());
        assertFalse(summary.sell().amountValueIncomplete());
        assertTrue(summary.total().amountValueIncomplete());
        assertDecimal("10000", summary.buy().notional(), "notional does not depend on prices");
    }

    private static void assertDecimal(String expected, BigDecimal actual, String message) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), message);
    }

    @Test
    @DisplayName("absent side → zero-filled")
    void absentSide() throws Exception {
        TradeSummary summary = adapter.resolve(json("{\"BUY\": {}}"), PRICES);
        assertEquals(SideSummary.EMPTY, summary.buy());
        assertEquals(SideSummary.EMPTY, summary.sell());
    }

    @Test
    @DisplayName("quote asset bought against itself is valued at 1")
    void quoteAssetPricedAtOne() throws Exception {
        TradeSummary summary = adapter.resolve(json("""
            {"BUY": {"count": {"USDT": {"USDT": 1}}, "amount": {"USDT": {"USDT": 25}},
                     "notional": {"USDT": {"USDT": 25}}, "fee": {"USDT": {"USDT": 0}}}}
            """), Map.of());
        assertDecimal("25", summary.buy().amountValue());
        assertFalse(summary.buy().amountValueIncomplete());
    }

    @Test
    @DisplayName("malformed payloads rejected")
    void malformed() throws Exception {
        assertThrows(PayloadShapeException.class, () -> adapter.resolve(json("[]"), PRICES));
        assertThrows(PayloadShapeException.class, () -> adapter.resolve(json("{\"BUY\": 3}"), PRICES));
        assertThrows(PayloadShapeException.class,
            () -> adapter.resolve(json("{\"BUY\": {\"count\": {\"BTC\": {\"USDT\": \"1.5\"}}}}"), PRICES));
        assertThrows(PayloadShapeException.class,
            () -> adapter.resolve(json("{\"BUY\": {\"fee\": {\"BTC\": {\"USDT\": \"n/a\"}}}}"), PRICES));
    }

    @Test
    @DisplayName("assetsIn() lists traded bases without the quote asset")
    void assetsIn() throws Exception {
        assertEquals(Set.of("BTC", "ETH"), adapter.assetsIn(json(PAYLOAD)));
    }
}
