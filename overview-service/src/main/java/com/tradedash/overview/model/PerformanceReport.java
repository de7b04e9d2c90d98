package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradedash.analytics.multiples.CapitalSnapshot;
import com.tradedash.analytics.multiples.Multiples;
import com.tradedash.analytics.rate.NormalizedRates;
import com.tradedash.analytics.trade.TradeSummary;

/**
 * Everything the performance view shows for one trades overview.
 * {@code rates} is null when the observation span is unknown.
 */
public record PerformanceReport(
    @JsonProperty("quote_asset") String quoteAsset,
    @JsonProperty("trades")      TradeSummary trades,
    @JsonProperty("capital")     CapitalSnapshot capital,
    @JsonProperty("multiples")   Multiples multiples,
    @JsonProperty("rates")       NormalizedRates rates
) {
    /** P&amp;L figures understate reality when a traded asset had no price. */
    public boolean incomplete() {
        return trades.total().amountValueIncomplete();
    }
}
