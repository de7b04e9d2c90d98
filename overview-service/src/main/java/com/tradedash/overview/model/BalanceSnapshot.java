package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Resolved {@code /balance}: every asset with its quote price, and the equity
 * they add up to.
 */
public record BalanceSnapshot(
    @JsonProperty("quote_asset") String quoteAsset,
    @JsonProperty("equity")      BigDecimal equity,
    @JsonProperty("assets")      List<BalanceAsset> assets
) {
    /** Slices below this share are merged into {@link PortfolioSlice#OTHER}. */
    public static final BigDecimal MIN_SLICE_SHARE = new BigDecimal("0.01");

    public BalanceSnapshot {
        assets = List.copyOf(assets);
        equity = equity != null ? equity : BigDecimal.ZERO;
    }

    public static BalanceSnapshot empty(String quoteAsset) {
        return new BalanceSnapshot(quoteAsset, BigDecimal.ZERO, List.of());
    }

    public static BalanceSnapshot of(String quoteAsset, List<BalanceAsset> assets) {
        BigDecimal equity = assets.stream()
            .map(BalanceAsset::value)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new BalanceSnapshot(quoteAsset, equity, assets);
    }

    /** True when at least one asset has no price, so {@link #equity()} is understated. */
    public boolean hasUnpricedAssets() {
        return assets.stream().anyMatch(a -> !a.isPriced());
    }

    /**
     * Share of each asset in the total value, largest first. Assets under 1 % are
     * merged into a trailing {@code Other} slice. Empty when nothing has value.
     */
    public List<PortfolioSlice> portfolio() {
        BigDecimal totalValue = assets.stream()
            .map(BalanceAsset::value)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        if (totalValue.signum() <= 0) {
            return List.of();
        }

        List<PortfolioSlice> major = new ArrayList<>();
        BigDecimal other = BigDecimal.ZERO;
        for (BalanceAsset asset : assets) {
            BigDecimal share = asset.value().divide(totalValue, MathContext.DECIMAL64);
            if (share.compareTo(MIN_SLICE_SHARE) >= 0) {
                major.add(new PortfolioSlice(asset.asset(), asset.value(), share));
            } else {
                other = other.add(asset.value());
            }
        }
        major.sort(Comparator.comparing(PortfolioSlice::value).reversed());
        if (other.signum() > 0) {
            major.add(new PortfolioSlice(PortfolioSlice.OTHER, other, other.divide(totalValue, MathContext.DECIMAL64)));
        }
        return List.copyOf(major);
    }
}
