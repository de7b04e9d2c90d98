package com.tradedash.analytics.palette;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps a record's age to a fading row color so that recent activity stands out.
 *
 * <h3>Buckets</h3>
 * <pre>
 *   bucket = floor(age / freshWindow)
 *   0            base color per status
 *   j            base color blended toward black by j / (levels − 1)
 *   levels − 1   #000000 for every status
 *   ≥ levels     unstyled (record is stale)
 * </pre>
 *
 * <p>Text color is the higher-contrast of black and white against each
 * background, computed once per palette and never re-derived per record.
 *
 * <h3>Failure policy</h3>
 * <p>A missing or unparsable timestamp and an unknown status both leave the row
 * unstyled. A timestamp in the future counts as bucket 0.
 *
 * <p>Palettes are memoized per {@code levels}. Stateless otherwise, and
 * thread-safe.
 */
public final class AgingPaletteEngine {

    /** Luminance at or above which black text is used. */
    public static final double CONTRAST_THRESHOLD = 128.0;

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    private static final Map<Integer, Palette> PALETTES = new ConcurrentHashMap<>();

    private final ZoneId zone;

    /** @param zone zone for timestamps that carry no offset */
    public AgingPaletteEngine(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public AgingPaletteEngine() {
        this(ZoneId.of("UTC"));
    }

    /**
     * Returns the palette for {@code levels} buckets, building it on first use.
     *
     * @throws IllegalArgumentException if {@code levels < 2}
     */
    public static Palette buildPalette(int levels) {
        if (levels < 2) {
            throw new IllegalArgumentException("visual degradation levels must be at least 2, got " + levels);
        }
        return PALETTES.computeIfAbsent(levels, AgingPaletteEngine::createPalette);
    }

    /** {@code #000000} on light backgrounds (YIQ ≥ 128), {@code #ffffff} otherwise. */
    public static String contrastText(String background) {
        return contrastText(HexColor.parse(background)).toHex();
    }

    public static HexColor contrastText(HexColor background) {
        return background.luminance() >= CONTRAST_THRESHOLD ? HexColor.BLACK : HexColor.WHITE;
    }

    /**
     * Age bucket for a record updated at {@code updatedAt}, observed at {@code now}.
     * Negative ages clamp to 0; the result may be ≥ levels and saturates at
     * {@link Long#MAX_VALUE}. Exact to the nanosecond for any positive window.
     */
    public static long bucketFor(Instant updatedAt, Instant now, Duration freshWindow) {
        if (freshWindow == null || freshWindow.isZero() || freshWindow.isNegative()) {
            throw new IllegalArgumentException("fresh window must be positive, got " + freshWindow);
        }
        Duration age = Duration.between(updatedAt, now);
        if (age.isNegative()) {
            return 0;
        }
        BigInteger bucket = nanos(age).divide(nanos(freshWindow));
        return bucket.bitLength() < Long.SIZE ? bucket.longValue() : Long.MAX_VALUE;
    }

    /**
     * Style for one record.
     *
     * @return the background/foreground pair, or empty when the record is stale,
     *         has no determinable age, or has a status outside the palette
     */
    public Optional<RowStyle> styleFor(AgedRecord record, Palette palette, Duration freshWindow, Instant now) {
        Optional<Instant> updatedAt = RecordTimestamps.parse(record.updatedAt(), zone);
        if (updatedAt.isEmpty()) {
            return Optional.empty();
        }

        long bucket = bucketFor(updatedAt.get(), now, freshWindow);
        if (bucket >= palette.levels()) {
            return Optional.empty();
        }

        int index = (int) bucket;
        String key = OrderStatus.normalizeKey(record.status());
        return palette.background(index, key)
            .flatMap(bg -> palette.foreground(index, key).map(fg -> new RowStyle(bg, fg)));
    }

    public Optional<RowStyle> styleFor(AgedRecord record, int levels, Duration freshWindow, Instant now) {
        return styleFor(record, buildPalette(levels), freshWindow, now);
    }

    private static BigInteger nanos(Duration duration) {
        return BigInteger.valueOf(duration.getSeconds())
            .multiply(NANOS_PER_SECOND)
            .add(BigInteger.valueOf(duration.getNano()));
    }

    private static Palette createPalette(int levels) {
        List<Map<String, String>> background = new ArrayList<>(levels);
        for (int bucket = 0; bucket < levels; bucket++) {
            Map<String, String> colors = new LinkedHashMap<>();
            for (OrderStatus status : OrderStatus.values()) {
                colors.put(status.key(), backgroundFor(status, bucket, levels));
            }
            background.add(colors);
        }

        List<Map<String, String>> foreground = new ArrayList<>(levels);
        for (Map<String, String> colors : background) {
            Map<String, String> text = new LinkedHashMap<>();
            colors.forEach((key, bg) -> text.put(key, contrastText(bg)));
            foreground.add(text);
        }
        return new Palette(levels, background, foreground);
    }

    private static String backgroundFor(OrderStatus status, int bucket, int levels) {
        if (bucket == 0) {
            return status.baseColor();
        }
        if (bucket == levels - 1) {
            return HexColor.BLACK.toHex();
        }
        double fade = (double) bucket / (levels - 1);
        return HexColor.parse(status.baseColor()).darken(fade).toHex();
    }
}
