package com.tradedash.analytics.format;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Renders headline metrics (counts, cash amounts, return ratios) and their
 * change against a reference value.
 *
 * <p>Unlike {@link PrecisionFormatter} these use fixed precision: headline
 * figures are large enough that two decimals always suffice. Absent values still
 * render as {@link PrecisionFormatter#ZERO_DISPLAY}.
 */
public final class MetricFormatter {

    /** Prefixed to figures computed from incomplete or mismatching inputs. */
    public static final String WARNING_MARKER = "⚠️";

    /** Ratios at or above this magnitude read better as multiples than as percentages. */
    private static final BigDecimal MULTIPLE_THRESHOLD = BigDecimal.valueOf(2);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);

    private MetricFormatter() {}

    public enum Kind { INTEGER, AMOUNT, RATIO }

    public static String integer(BigDecimal value, String unit) {
        if (value == null) return PrecisionFormatter.ZERO_DISPLAY;
        return PrecisionFormatter.withUnit(pattern("#,##0").format(value), unit);
    }

    public static String amount(BigDecimal value, String unit) {
        if (value == null) return PrecisionFormatter.ZERO_DISPLAY;
        return PrecisionFormatter.withUnit(pattern("#,##0.00").format(value), unit);
    }

    /**
     * Renders a return ratio: {@code 0.1234 → "12.34%"} while {@code |v| < 2},
     * {@code 2.5 → "2.50×"} from there on.
     */
    public static String ratio(BigDecimal value) {
        if (value == null) return PrecisionFormatter.ZERO_DISPLAY;
        if (value.abs().compareTo(MULTIPLE_THRESHOLD) < 0) {
            return pattern("#,##0.00").format(value.multiply(HUNDRED)) + "%";
        }
        return pattern("#,##0.00").format(value) + "×";
    }

    public static String format(BigDecimal value, Kind kind, String unit) {
        return switch (kind) {
            case INTEGER -> integer(value, unit);
            case AMOUNT  -> amount(value, unit);
            case RATIO   -> ratio(value);
        };
    }

    /**
     * Signed change of {@code current} against {@code reference}, e.g.
     * {@code "+1,234.00 USDT"} or {@code "-0.50%"}.
     *
     * @return the rendered delta, or {@code null} when either side is absent
     */
    public static String delta(BigDecimal current, BigDecimal reference, Kind kind, String unit) {
        if (current == null || reference == null) {
            return null;
        }
        BigDecimal change = current.subtract(reference);
        return switch (kind) {
            case INTEGER -> PrecisionFormatter.withUnit(pattern("+#,##0;-#,##0").format(change), unit);
            case AMOUNT  -> PrecisionFormatter.withUnit(pattern("+#,##0.00;-#,##0.00").format(change), unit);
            case RATIO   -> pattern("+#,##0.00;-#,##0.00").format(change.multiply(HUNDRED)) + "%";
        };
    }

    public static String warn(String text, boolean flagged) {
        return flagged ? WARNING_MARKER + " " + text : text;
    }

    private static DecimalFormat pattern(String pattern) {
        DecimalFormat format = new DecimalFormat(pattern, SYMBOLS);
        format.setRoundingMode(RoundingMode.HALF_EVEN);
        return format;
    }
}
