package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One row of the {@code /balance} payload after shape resolution.
 * {@code quotePrice} is null when no price could be resolved for the asset.
 */
public record BalanceAsset(
    @JsonProperty("asset")       String asset,
    @JsonProperty("free")        BigDecimal free,
    @JsonProperty("used")        BigDecimal used,
    @JsonProperty("total")       BigDecimal total,
    @JsonProperty("quote_price") BigDecimal quotePrice
) {
    public BalanceAsset {
        Objects.requireNonNull(asset, "asset");
        free = free != null ? free : BigDecimal.ZERO;
        used = used != null ? used : BigDecimal.ZERO;
        total = total != null ? total : BigDecimal.ZERO;
    }

    /** Quote-denominated value; zero when the price is missing. */
    @JsonIgnore
    public BigDecimal value() {
        return quotePrice == null ? BigDecimal.ZERO : total.multiply(quotePrice);
    }

    @JsonIgnore
    public boolean isPriced() {
        return quotePrice != null;
    }
}
