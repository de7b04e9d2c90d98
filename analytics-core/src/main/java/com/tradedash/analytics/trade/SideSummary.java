package com.tradedash.analytics.trade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Aggregated figures for one side of the trade book (or for both, as TOTAL).
 *
 * <p>{@code amountValueIncomplete} marks a figure that is missing the value of at
 * least one trade. It combines by logical OR, never by summation.
 */
public record SideSummary(
    @JsonProperty("count")                   long count,
    @JsonProperty("notional")                BigDecimal notional,
    @JsonProperty("fee")                     BigDecimal fee,
    @JsonProperty("amount_value")            BigDecimal amountValue,
    @JsonProperty("amount_value_incomplete") boolean amountValueIncomplete
) {
    public static final SideSummary EMPTY =
        new SideSummary(0, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, false);

    public SideSummary {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, got " + count);
        }
        notional = notional != null ? notional : BigDecimal.ZERO;
        fee = fee != null ? fee : BigDecimal.ZERO;
        amountValue = amountValue != null ? amountValue : BigDecimal.ZERO;
    }

    public SideSummary plus(SideSummary other) {
        return new SideSummary(
            count + other.count,
            notional.add(other.notional),
            fee.add(other.fee),
            amountValue.add(other.amountValue),
            amountValueIncomplete || other.amountValueIncomplete
        );
    }

    /** Mean notional per order; zero when there are no orders. */
    public BigDecimal averageOrderSize() {
        if (count == 0) return BigDecimal.ZERO;
        return notional.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }
}
