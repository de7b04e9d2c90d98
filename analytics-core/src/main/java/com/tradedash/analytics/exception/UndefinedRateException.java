package com.tradedash.analytics.exception;

import java.time.Duration;

/** Raised when a rate is requested over a non-positive timespan. */
public class UndefinedRateException extends AnalyticsException {

    public UndefinedRateException(Duration elapsed) {
        super(Kind.UNDEFINED_FIGURE, "RateNormalizer", "timespan must be positive, got " + elapsed);
    }
}
