package com.tradedash.analytics.rate;

public enum RatePeriod {
    HOUR("h", 1),
    DAY("day", 24);

    private final String label;
    private final int hours;

    RatePeriod(String label, int hours) {
        this.label = label;
        this.hours = hours;
    }

    /** Unit suffix shown after a rate, as in {@code "12.50 USDT/h"}. */
    public String label() {
        return label;
    }

    public int hours() {
        return hours;
    }
}
