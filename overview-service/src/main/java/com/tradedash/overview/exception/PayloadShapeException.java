package com.tradedash.overview.exception;

import com.tradedash.analytics.exception.AnalyticsException;

/**
 * A back-end payload matched none of the shapes its adapter understands, or lacks
 * a mandatory column. Raised instead of guessing so that no false figure reaches
 * the dashboard.
 */
public class PayloadShapeException extends AnalyticsException {

    public PayloadShapeException(String endpoint, String message) {
        super(Kind.MALFORMED_INPUT, endpoint, message);
    }

    public PayloadShapeException(String endpoint, String message, Throwable cause) {
        super(Kind.MALFORMED_INPUT, endpoint, message, cause);
    }
}
