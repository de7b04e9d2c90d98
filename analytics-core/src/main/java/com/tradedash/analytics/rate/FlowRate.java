package com.tradedash.analytics.rate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Trading flow per unit of time: notional traded, orders placed and fees paid.
 */
public record FlowRate(
    @JsonProperty("notional")    BigDecimal notional,
    @JsonProperty("order_count") BigDecimal orderCount,
    @JsonProperty("fee")         BigDecimal fee
) {
    public FlowRate plus(FlowRate other) {
        return new FlowRate(notional.add(other.notional), orderCount.add(other.orderCount), fee.add(other.fee));
    }

    public FlowRate times(BigDecimal factor) {
        return new FlowRate(notional.multiply(factor), orderCount.multiply(factor), fee.multiply(factor));
    }
}
