package com.tradedash.analytics.trade;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * BUY / SELL / TOTAL view of a trade book. Both sides are always present;
 * TOTAL is always {@code buy.plus(sell)}.
 */
public record TradeSummary(
    @JsonProperty("BUY")   SideSummary buy,
    @JsonProperty("SELL")  SideSummary sell,
    @JsonProperty("TOTAL") SideSummary total
) {
    public TradeSummary {
        buy = buy != null ? buy : SideSummary.EMPTY;
        sell = sell != null ? sell : SideSummary.EMPTY;
        // a supplied TOTAL is recomputed, never trusted
        total = buy.plus(sell);
    }

    public static TradeSummary of(SideSummary buy, SideSummary sell) {
        return new TradeSummary(buy, sell, null);
    }

    public SideSummary side(TradeSide side) {
        Objects.requireNonNull(side, "side");
        return side == TradeSide.BUY ? buy : sell;
    }
}
