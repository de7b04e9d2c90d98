package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradedash.analytics.reconcile.MetricSet;

/**
 * Resolved {@code /overview/assets}: the same equity breakdown computed from the
 * balance endpoint and from the open order book.
 */
public record AssetsOverview(
    @JsonProperty("cash_asset")      String cashAsset,
    @JsonProperty("balance_source")  MetricSet balanceSource,
    @JsonProperty("orders_source")   MetricSet ordersSource
) {}
