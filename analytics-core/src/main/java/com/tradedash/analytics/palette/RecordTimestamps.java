package com.tradedash.analytics.palette;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Lenient parsing of record timestamps. Accepted forms, tried in order:
 * <ol>
 *   <li>epoch milliseconds ({@code "1718000000000"})</li>
 *   <li>ISO-8601 instant ({@code "2024-06-10T06:13:20Z"})</li>
 *   <li>ISO-8601 offset date-time ({@code "2024-06-10T08:13:20+02:00"})</li>
 *   <li>local date-time, {@code "2024-06-10 06:13:20"} or ISO form, in the given zone</li>
 * </ol>
 * Anything else yields an empty result: the record has no determinable age.
 */
public final class RecordTimestamps {

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private RecordTimestamps() {}

    public static Optional<Instant> parse(String raw, ZoneId zone) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.chars().allMatch(Character::isDigit)) {
            return attempt(() -> Instant.ofEpochMilli(Long.parseLong(text)));
        }
        return attempt(() -> Instant.parse(text))
            .or(() -> attempt(() -> OffsetDateTime.parse(text).toInstant()))
            .or(() -> attempt(() -> LocalDateTime.parse(text, DISPLAY).atZone(zone).toInstant()))
            .or(() -> attempt(() -> LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
                .atZone(zone).toInstant()));
    }

    /** Renders an instant as {@code yyyy-MM-dd HH:mm:ss} in {@code zone}; empty for null. */
    public static String display(Instant instant, ZoneId zone) {
        return instant == null ? "" : DISPLAY.format(instant.atZone(zone));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }
}
