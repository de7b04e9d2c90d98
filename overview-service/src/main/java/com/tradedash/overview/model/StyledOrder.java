package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradedash.analytics.palette.RowStyle;

import java.math.BigDecimal;

/**
 * An order row ready for the table: status light, freshness style (null when
 * unstyled) and execution latency in seconds (null while open).
 */
public record StyledOrder(
    @JsonProperty("order")           OrderRow order,
    @JsonProperty("light")           String light,
    @JsonProperty("style")           RowStyle style,
    @JsonProperty("latency_seconds") BigDecimal latencySeconds
) {}
