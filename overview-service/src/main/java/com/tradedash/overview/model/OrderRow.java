package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradedash.analytics.palette.AgedRecord;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One row of {@code /orders}. Timestamps are epoch milliseconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OrderRow(
    @JsonProperty("id")        String id,
    @JsonProperty("symbol")    String symbol,
    @JsonProperty("status")    String status,
    @JsonProperty("side")      String side,
    @JsonProperty("type")      String type,
    @JsonProperty("ts_create") Long tsCreate,
    @JsonProperty("ts_update") Long tsUpdate,
    @JsonProperty("ts_finish") Long tsFinish
) implements AgedRecord {

    @Override
    @JsonIgnore
    public String updatedAt() {
        return tsUpdate == null ? null : String.valueOf(tsUpdate);
    }

    /** Seconds from creation to finish; empty while the order is still open. */
    @JsonIgnore
    public Optional<BigDecimal> executionLatencySeconds() {
        if (tsCreate == null || tsFinish == null) {
            return Optional.empty();
        }
        return Optional.of(BigDecimal.valueOf(tsFinish - tsCreate, 3));
    }
}
