package com.tradedash.analytics.reconcile;

import com.tradedash.analytics.exception.AnalyticsException;
import com.tradedash.analytics.exception.MissingFieldException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationDetectorTest {

    private static MetricSet set(String source, Object... fieldValues) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        for (int i = 0; i < fieldValues.length; i += 2) {
            values.put((String) fieldValues[i], new BigDecimal((String) fieldValues[i + 1]));
        }
        return new MetricSet(source, values);
    }

    @Test
    @DisplayName("exact comparison — a difference of 1e-7 is a mismatch")
    void exactComparison() {
        MismatchMap result = ReconciliationDetector.reconcile(
            set("balance_source", "total_equity", "100"),
            set("orders_source", "total_equity", "100.0000001"),
            List.of("total_equity"));

        assertEquals(Map.of("total_equity", true), result.flags());
        assertTrue(result.anyMismatch());
    }

    @Test
    @DisplayName("scale does not matter — 100 equals 100.00")
    void scaleInsensitive() {
        MismatchMap result = ReconciliationDetector.reconcile(
            set("balance_source", "total_equity", "100"),
            set("orders_source", "total_equity", "100.00"),
            List.of("total_equity"));

        assertFalse(result.isMismatch("total_equity"));
        assertFalse(result.anyMismatch());
        assertTrue(result.mismatchedFields().isEmpty());
    }

    @Test
    @DisplayName("one entry per requested field, in request order")
    void entryPerField() {
        MetricSet balance = set("balance_source",
            "cash_frozen_value", "50", "assets_frozen_value", "20", "total_frozen_value", "70");
        MetricSet orders = set("orders_source",
            "cash_frozen_value", "50", "assets_frozen_value", "25", "total_frozen_value", "75");

        MismatchMap result = ReconciliationDetector.reconcile(balance, orders);

        assertEquals(StandardFields.RECONCILED, List.copyOf(result.flags().keySet()));
        assertFalse(result.isMismatch(StandardFields.CASH_FROZEN_VALUE));
        assertEquals(List.of(StandardFields.TOTAL_FROZEN_VALUE, StandardFields.ASSETS_FROZEN_VALUE),
            result.mismatchedFields());
    }

    @Test
    @DisplayName("field missing from either set → MissingFieldException naming it")
    void missingField() {
        MetricSet balance = set("balance_source", "total_equity", "100", "cash_total_value", "40");
        MetricSet orders = set("orders_source", "total_equity", "100");

        MissingFieldException ex = assertThrows(MissingFieldException.class,
            () -> ReconciliationDetector.reconcile(balance, orders, List.of("total_equity", "cash_total_value")));
        assertEquals("cash_total_value", ex.getField());
        assertEquals("orders_source", ex.getSource());
        assertTrue(ex.getMessage().contains("cash_total_value"));
        assertEquals(AnalyticsException.Kind.MISSING_DATA, ex.kind());
        assertFalse(ex.rendersAsSentinel(), "a missing field must not be shown as --");

        MissingFieldException reversed = assertThrows(MissingFieldException.class,
            () -> ReconciliationDetector.reconcile(orders, balance, List.of("cash_total_value")));
        assertEquals("orders_source", reversed.getSource());
    }

    @Test
    @DisplayName("null value counts as missing")
    void nullValueMissing() {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put("total_equity", null);
        MetricSet withNull = new MetricSet("orders_source", values);

        assertThrows(MissingFieldException.class, () -> ReconciliationDetector.reconcile(
            set("balance_source", "total_equity", "1"), withNull, List.of("total_equity")));
    }

    @Test
    @DisplayName("inputs are left untouched and cannot be modified")
    void inputsUntouched() {
        MetricSet balance = set("balance_source", "total_equity", "100");
        MetricSet orders = set("orders_source", "total_equity", "101");
        Map<String, BigDecimal> before = Map.copyOf(balance.values());

        ReconciliationDetector.reconcile(balance, orders, List.of("total_equity"));

        assertEquals(before, balance.values());
        assertThrows(UnsupportedOperationException.class, () -> balance.values().put("x", BigDecimal.ONE));
    }
}
