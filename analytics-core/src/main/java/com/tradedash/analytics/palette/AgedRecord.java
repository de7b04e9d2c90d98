package com.tradedash.analytics.palette;

/**
 * A time-ordered record that can be styled by age.
 */
public interface AgedRecord {

    /** Status as delivered or displayed, e.g. {@code "filled"} or {@code "Partially filled"}. */
    String status();

    /**
     * Last update time as raw text; may be null or unparsable.
     *
     * @see RecordTimestamps#parse(String, java.time.ZoneId)
     */
    String updatedAt();
}
