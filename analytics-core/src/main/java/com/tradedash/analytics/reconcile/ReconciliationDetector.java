package com.tradedash.analytics.reconcile;

import com.tradedash.analytics.exception.MissingFieldException;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares two independently computed {@link MetricSet}s field by field.
 *
 * <p>Comparison is exact: {@code 100} and {@code 100.00} match, {@code 100} and
 * {@code 100.0000001} do not. Both sources derive their figures from the same
 * ledger, so any difference is a bookkeeping divergence.
 *
 * <p>Every requested field must be present in both sets. A missing field raises
 * {@link MissingFieldException}; skipping it would report a false "all clear".
 * Neither input is modified.
 */
public final class ReconciliationDetector {

    private ReconciliationDetector() {}

    public static MismatchMap reconcile(MetricSet a, MetricSet b, List<String> fields) {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (String field : fields) {
            BigDecimal left = require(a, field);
            BigDecimal right = require(b, field);
            flags.put(field, left.compareTo(right) != 0);
        }
        return new MismatchMap(flags);
    }

    /** Reconciles the {@link StandardFields#RECONCILED frozen-amount} fields. */
    public static MismatchMap reconcile(MetricSet a, MetricSet b) {
        return reconcile(a, b, StandardFields.RECONCILED);
    }

    private static BigDecimal require(MetricSet set, String field) {
        return set.get(field).orElseThrow(() -> new MissingFieldException(field, set.source()));
    }
}
