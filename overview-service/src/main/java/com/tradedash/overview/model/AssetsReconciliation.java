package com.tradedash.overview.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradedash.analytics.reconcile.MismatchMap;

public record AssetsReconciliation(
    @JsonProperty("overview")   AssetsOverview overview,
    @JsonProperty("mismatch")   MismatchMap mismatch
) {}
