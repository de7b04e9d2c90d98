package com.tradedash.analytics.reconcile;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One computation source's view of a concept, e.g. {@code balance_source} or
 * {@code orders_source}. Values are held in an unmodifiable copy.
 */
public record MetricSet(
    @JsonProperty("source") String source,
    @JsonProperty("values") Map<String, BigDecimal> values
) {
    public MetricSet {
        Objects.requireNonNull(source, "source");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Optional<BigDecimal> get(String field) {
        return Optional.ofNullable(values.get(field));
    }

    public boolean has(String field) {
        return values.get(field) != null;
    }
}
