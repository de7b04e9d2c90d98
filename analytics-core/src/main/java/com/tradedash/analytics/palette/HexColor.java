package com.tradedash.analytics.palette;

import java.util.Locale;

/**
 * An sRGB color with 8-bit channels, written as {@code #rrggbb}.
 */
public record HexColor(int red, int green, int blue) {

    public static final HexColor BLACK = new HexColor(0, 0, 0);
    public static final HexColor WHITE = new HexColor(255, 255, 255);

    public HexColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /**
     * Parses {@code #rrggbb} or the {@code #rgb} shorthand; the leading {@code #}
     * is optional and case is ignored.
     *
     * @throws IllegalArgumentException for any other input
     */
    public static HexColor parse(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("color must not be null");
        }
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() == 3) {
            StringBuilder expanded = new StringBuilder(6);
            for (char c : digits.toCharArray()) {
                expanded.append(c).append(c);
            }
            digits = expanded.toString();
        }
        if (digits.length() != 6) {
            throw new IllegalArgumentException("not a hex color: " + hex);
        }
        try {
            return new HexColor(
                Integer.parseInt(digits.substring(0, 2), 16),
                Integer.parseInt(digits.substring(2, 4), 16),
                Integer.parseInt(digits.substring(4, 6), 16));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("not a hex color: " + hex, e);
        }
    }

    /**
     * Blends toward black: each channel becomes {@code round(channel × (1 − fraction))},
     * rounding half to even, clamped to 0–255.
     *
     * @param fraction 0 keeps the color, 1 gives black
     */
    public HexColor darken(double fraction) {
        double keep = 1.0 - fraction;
        return new HexColor(scale(red, keep), scale(green, keep), scale(blue, keep));
    }

    /** YIQ perceptual luminance, {@code (R·299 + G·587 + B·114) / 1000}, in 0–255. */
    public double luminance() {
        return (red * 299 + green * 587 + blue * 114) / 1000.0;
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02x%02x%02x", red, green, blue);
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static int scale(int channel, double keep) {
        long scaled = (long) Math.rint(channel * keep);
        return (int) Math.max(0, Math.min(255, scaled));
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " channel out of range: " + value);
        }
    }
}
