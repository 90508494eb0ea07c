package com.raditha.antmetrics.store;

import java.io.IOException;

/**
 * Thrown when a persisted metric record does not match the expected schema.
 */
public class MalformedMetricRecordException extends IOException {

    private final String field;

    public MalformedMetricRecordException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public MalformedMetricRecordException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    /**
     * Path of the offending field, for example {@code final_metrics.meanVij[2].value}.
     */
    public String field() {
        return field;
    }
}
