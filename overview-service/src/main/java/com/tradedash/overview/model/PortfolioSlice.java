package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** One slice of the portfolio breakdown; {@code share} is a fraction in [0, 1]. */
public record PortfolioSlice(
    @JsonProperty("asset") String asset,
    @JsonProperty("value") BigDecimal value,
    @JsonProperty("share") BigDecimal share
) {
    public static final String OTHER = "Other";
}
