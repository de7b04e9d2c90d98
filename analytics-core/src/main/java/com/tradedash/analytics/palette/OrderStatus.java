package com.tradedash.analytics.palette;

import java.util.Locale;
import java.util.Optional;

/**
 * Order lifecycle states with their display attributes. {@code baseColor} is the
 * freshest row background; rows fade toward black as they age.
 */
public enum OrderStatus {
    NEW("new", "🟣", "#aa55ff"),
    PARTIALLY_FILLED("partially_filled", "🔵", "#11aaff"),
    FILLED("filled", "🟢", "#00ff00"),
    PARTIALLY_CANCELED("partially_canceled", "🟡", "#fff700"),
    CANCELED("canceled", "🔴", "#ff5555"),
    REJECTED("rejected", "🔴", "#ff5555"),
    EXPIRED("expired", "🔴", "#ff5555");

    /** Light shown for statuses outside this enum. */
    public static final String UNKNOWN_LIGHT = "⚪";

    private final String key;
    private final String light;
    private final String baseColor;

    OrderStatus(String key, String light, String baseColor) {
        this.key = key;
        this.light = light;
        this.baseColor = baseColor;
    }

    public String key() {
        return key;
    }

    public String light() {
        return light;
    }

    public String baseColor() {
        return baseColor;
    }

    /** {@code "partially_filled" → "Partially filled"}. */
    public String label() {
        String spaced = key.replace('_', ' ');
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    /** Lower-cases and replaces spaces with underscores: {@code "Partially filled" → "partially_filled"}. */
    public static String normalizeKey(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    public static Optional<OrderStatus> fromKey(String raw) {
        String key = normalizeKey(raw);
        for (OrderStatus status : values()) {
            if (status.key.equals(key)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }

    public static String lightFor(String raw) {
        return fromKey(raw).map(OrderStatus::light).orElse(UNKNOWN_LIGHT);
    }
}
