package com.tradedash.analytics.palette;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RowStyle(
    @JsonProperty("background") String background,
    @JsonProperty("foreground") String foreground
) {
    /** Inline CSS for a table cell. */
    public String css() {
        return "background-color:" + background + ";color:" + foreground;
    }
}
