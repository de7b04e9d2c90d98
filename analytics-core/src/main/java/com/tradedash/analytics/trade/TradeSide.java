package com.tradedash.analytics.trade;

import java.util.Locale;

public enum TradeSide {
    BUY("↗ BUY"),
    SELL("↘ SELL");

    private final String marker;

    TradeSide(String marker) {
        this.marker = marker;
    }

    /** Arrow-prefixed label used in order tables. */
    public String marker() {
        return marker;
    }

    /**
     * Case-insensitive lookup ({@code "buy"}, {@code "Sell"}).
     *
     * @throws IllegalArgumentException for null or unknown sides
     */
    public static TradeSide parse(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("trade side must not be null");
        }
        return TradeSide.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
