package com.tradedash.overview.adapter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradedash.overview.config.DashboardConfig;
import com.tradedash.overview.config.DashboardSettings;
import com.tradedash.overview.exception.PayloadShapeException;
import com.tradedash.overview.model.AssetsOverview;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AssetsOverviewAdapterTest {

    static final String PAYLOAD = """
        {"balance_source": {"total_equity": 1500, "total_frozen_value": "100",
                            "cash_frozen_value": 40, "assets_frozen_value": 60, "label": null},
         "orders_source":  {"total_frozen_value": 100.00, "cash_frozen_value": 40,
                            "assets_frozen_value": "60.5"},
         "misc": {"cash_asset": "USDC"}}
        """;

    private final ObjectMapper mapper = new DashboardConfig().objectMapper();
    private final AssetsOverviewAdapter adapter = new AssetsOverviewAdapter(mapper,
        new DashboardSettings("USDT", Duration.ofSeconds(300), 12, ZoneId.of("UTC")));

    @Test
    @DisplayName("both sources resolved, field order kept")
    void resolves() {
        AssetsOverview overview = adapter.resolve(PAYLOAD);

        assertEquals("USDC", overview.cashAsset());
        assertEquals(AssetsOverviewAdapter.BALANCE_SOURCE, overview.balanceSource().source());
        assertEquals(List.of("total_equity", "total_frozen_value", "cash_frozen_value", "assets_frozen_value"),
            List.copyOf(overview.balanceSource().values().keySet()));
        assertEquals(new BigDecimal("60.5"), overview.ordersSource().get("assets_frozen_value").orElseThrow());
        assertFalse(overview.balanceSource().has("label"));
    }

    @Test
    @DisplayName("cash asset falls back to the quote asset")
    void cashAssetFallback() {
        AssetsOverview overview = adapter.resolve("{\"balance_source\": {}, \"orders_source\": {}}");
        assertEquals("USDT", overview.cashAsset());
    }

    @Test
    @DisplayName("missing source block or non-object payload rejected")
    void malformed() {
        assertThrows(PayloadShapeException.class, () -> adapter.resolve("{\"balance_source\": {}}"));
        assertThrows(PayloadShapeException.class, () -> adapter.resolve("[]"));
        assertThrows(PayloadShapeException.class,
            () -> adapter.resolve("{\"balance_source\": {\"x\": \"abc\"}, \"orders_source\": {}}"));
    }
}
