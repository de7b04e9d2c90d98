package com.tradedash.analytics.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Adaptive-precision numeric-to-text conversion used for every figure the
 * dashboard displays.
 *
 * <h3>Rules</h3>
 * <ul>
 *   <li>{@code null}, NaN or exactly zero → {@value #ZERO_DISPLAY}</li>
 *   <li>{@code |v| ≥ 1} → thousands separators and exactly two decimals
 *       ({@code 1234.6565 → "1,234.66"})</li>
 *   <li>{@code 0 < |v| < 1} → first two <em>significant</em> digits kept
 *       ({@code 0.06565 → "0.066"}, {@code 0.0006565 → "0.00066"})</li>
 *   <li>sign prefixed after the magnitude is formatted; a non-null unit is
 *       appended as {@code " unit"}</li>
 * </ul>
 *
 * <p>Rounding is half-to-even at the computed scale. Stateless and thread-safe:
 * {@link DecimalFormat} instances are created per call.
 */
public final class PrecisionFormatter {

    /** Rendered for absent, NaN and zero values. */
    public static final String ZERO_DISPLAY = "--";

    private static final int SIGNIFICANT_DIGITS = 2;

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    private PrecisionFormatter() {}

    public static String format(BigDecimal value) {
        return format(value, null);
    }

    /**
     * Formats {@code value} with adaptive precision.
     *
     * @param value the figure to render; may be null
     * @param unit  optional suffix such as {@code "USDT"}; ignored when null or blank
     * @return the rendered text; never null
     */
    public static String format(BigDecimal value, String unit) {
        if (value == null || value.signum() == 0) {
            return ZERO_DISPLAY;
        }

        BigDecimal magnitude = value.abs();
        String formatted;
        if (magnitude.compareTo(BigDecimal.ONE) >= 0) {
            formatted = grouped(magnitude, 2);
        } else {
            // precision - scale - 1 == floor(log10(magnitude)) for any non-zero decimal
            int exponent = magnitude.precision() - magnitude.scale() - 1;
            int decimals = SIGNIFICANT_DIGITS - exponent - 1;
            formatted = magnitude.setScale(decimals, RoundingMode.HALF_EVEN).toPlainString();
        }

        if (value.signum() < 0) {
            formatted = "-" + formatted;
        }
        return withUnit(formatted, unit);
    }

    /**
     * {@code double} entry point for callers holding binary floating-point
     * figures. NaN and infinities render as {@value #ZERO_DISPLAY}.
     *
     * <p>Rounds the exact binary value, not its shortest decimal form: {@code 2.675}
     * is stored as {@code 2.67499999...} and renders as {@code "2.67"}.
     */
    public static String format(Double value, String unit) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return ZERO_DISPLAY;
        }
        return format(new BigDecimal(value), unit);
    }

    /**
     * Strips insignificant trailing zeros, then a dangling decimal point, from an
     * already formatted decimal string. {@code "1.230000" → "1.23"},
     * {@code "42.000" → "42"}. Strings without a decimal point are returned as is.
     */
    public static String stripTrailingZeros(String text) {
        if (text == null || text.indexOf('.') < 0) {
            return text;
        }
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '0') end--;
        if (end > 0 && text.charAt(end - 1) == '.') end--;
        return text.substring(0, end);
    }

    static String grouped(BigDecimal value, int decimals) {
        StringBuilder pattern = new StringBuilder("#,##0");
        if (decimals > 0) {
            pattern.append('.').append("0".repeat(decimals));
        }
        DecimalFormat format = new DecimalFormat(pattern.toString(), SYMBOLS);
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        return format.format(value);
    }

    static String withUnit(String formatted, String unit) {
        if (unit == null || unit.isBlank()) {
            return formatted;
        }
        return formatted + " " + unit;
    }
}
