package com.tradedash.overview.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Resolved {@code dashboard.*} properties.
 *
 * @param quoteAsset         asset every value is expressed in, e.g. {@code USDT}
 * @param freshWindow        width of one age bucket
 * @param visualDegradations number of age buckets in the row palette
 * @param zone               zone for timestamps that carry no offset
 */
public record DashboardSettings(
    String quoteAsset,
    Duration freshWindow,
    int visualDegradations,
    ZoneId zone
) {
    public DashboardSettings {
        Objects.requireNonNull(quoteAsset, "quoteAsset");
        Objects.requireNonNull(zone, "zone");
        if (freshWindow == null || freshWindow.isZero() || freshWindow.isNegative()) {
            throw new IllegalArgumentException("dashboard.fresh-window-seconds must be positive, got " + freshWindow);
        }
        if (visualDegradations < 2) {
            throw new IllegalArgumentException("dashboard.visual-degradations must be at least 2, got " + visualDegradations);
        }
    }
}
