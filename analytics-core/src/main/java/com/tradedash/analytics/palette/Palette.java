package com.tradedash.analytics.palette;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Background and foreground colors per age bucket and status key. Built by
 * {@link AgingPaletteEngine#buildPalette(int)}.
 *
 * @param levels     number of buckets, at least 2
 * @param background bucket index → status key → {@code #rrggbb}
 * @param foreground same shape; the text color paired with each background
 */
public record Palette(
    int levels,
    List<Map<String, String>> background,
    List<Map<String, String>> foreground
) {
    public Palette {
        if (background.size() != levels || foreground.size() != levels) {
            throw new IllegalArgumentException("palette must have exactly " + levels + " buckets");
        }
        background = List.copyOf(background.stream().map(Map::copyOf).toList());
        foreground = List.copyOf(foreground.stream().map(Map::copyOf).toList());
    }

    public Optional<String> background(int bucket, String statusKey) {
        return lookup(background, bucket, statusKey);
    }

    public Optional<String> foreground(int bucket, String statusKey) {
        return lookup(foreground, bucket, statusKey);
    }

    private Optional<String> lookup(List<Map<String, String>> buckets, int bucket, String statusKey) {
        if (bucket < 0 || bucket >= levels) {
            return Optional.empty();
        }
        return Optional.ofNullable(buckets.get(bucket).get(statusKey));
    }
}
