package com.tradedash.analytics.exception;

import java.util.Objects;

/**
 * Root of every failure raised while turning back-end data into dashboard figures.
 *
 * <h3>Kinds</h3>
 * <pre>
 *   UNDEFINED_FIGURE  the inputs are valid but the figure has no value
 *                     (a rate over an empty timespan); shown as the "--" sentinel
 *   MISSING_DATA      a figure needs a field one source did not provide
 *   MALFORMED_INPUT   a payload does not have any shape the adapters understand
 * </pre>
 *
 * <p>Only {@code UNDEFINED_FIGURE} may be rendered in place of the figure. The
 * other two mean the surrounding view cannot be trusted and must not show a number.
 */
public abstract class AnalyticsException extends RuntimeException {

    public enum Kind { UNDEFINED_FIGURE, MISSING_DATA, MALFORMED_INPUT }

    private final Kind kind;
    private final String origin;

    protected AnalyticsException(Kind kind, String origin, String message) {
        this(kind, origin, message, null);
    }

    protected AnalyticsException(Kind kind, String origin, String message, Throwable cause) {
        super(origin + ": " + message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.origin = origin;
    }

    public Kind kind() {
        return kind;
    }

    /** Component or endpoint the failure comes from, e.g. {@code RateNormalizer} or {@code /balance}. */
    public String origin() {
        return origin;
    }

    /** True when the affected figure can be displayed as the zero sentinel instead. */
    public boolean rendersAsSentinel() {
        return kind == Kind.UNDEFINED_FIGURE;
    }
}
