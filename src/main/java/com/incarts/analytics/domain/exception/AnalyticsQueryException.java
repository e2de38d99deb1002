package com.incarts.analytics.domain.exception;

/**
 * Base type for failures raised while planning or executing an analytical query.
 */
public class AnalyticsQueryException extends RuntimeException {

    public AnalyticsQueryException(String message) {
        super(message);
    }

    public AnalyticsQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
