package com.tradedash.analytics.exception;

/**
 * Raised when a field requested for reconciliation is absent from one of the
 * two metric sets. Never downgraded to a "match".
 */
public class MissingFieldException extends AnalyticsException {
    private final String field;
    private final String source;

    public MissingFieldException(String field, String source) {
        super(Kind.MISSING_DATA, "ReconciliationDetector", "field '" + field + "' missing from metric set '" + source + "'");
        this.field = field;
        this.source = source;
    }

    public String getField() {
        return field;
    }

    public String getSource() {
        return source;
    }
}
