package com.tradedash.analytics.multiples;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Performance figures derived by {@link MultiplesCalculator}. Ratio fields are
 * {@code null} whenever their denominator is zero or negative.
 */
public record Multiples(
    @JsonProperty("assets_current_value") BigDecimal assetsCurrentValue,
    @JsonProperty("net_investment")       BigDecimal netInvestment,
    @JsonProperty("gross_earnings")       BigDecimal grossEarnings,
    @JsonProperty("net_earnings")         BigDecimal netEarnings,
    @JsonProperty("gross_roi_on_cost")    BigDecimal grossRoiOnCost,
    @JsonProperty("net_roi_on_cost")      BigDecimal netRoiOnCost,
    @JsonProperty("gross_roi_on_value")   BigDecimal grossRoiOnValue,
    @JsonProperty("net_roi_on_value")     BigDecimal netRoiOnValue,
    @JsonProperty("rvpi")                 BigDecimal rvpi,
    @JsonProperty("dpi")                  BigDecimal dpi,
    @JsonProperty("tvpi")                 BigDecimal tvpi,
    @JsonProperty("roi_basis")            RoiBasis roiBasis
) {
    /** Multiple on invested capital; the same figure as TVPI. */
    @JsonIgnore
    public BigDecimal moic() {
        return tvpi;
    }

    /** Capital recovered beyond what was paid in; zero while capital is still at risk. */
    @JsonIgnore
    public BigDecimal freeCarrySurplus() {
        return netInvestment.signum() < 0 ? netInvestment.negate() : BigDecimal.ZERO;
    }
}
