package com.tradedash.analytics.rate;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Flow rates for every {@link FlowScope}, all expressed over the same {@link RatePeriod}.
 */
public record NormalizedRates(
    @JsonProperty("rates")  Map<FlowScope, FlowRate> rates,
    @JsonProperty("period") RatePeriod period
) {
    public NormalizedRates {
        rates = Map.copyOf(rates);
    }

    public FlowRate get(FlowScope scope) {
        return rates.get(scope);
    }
}
