package com.incarts.analytics.domain.exception;

/**
 * A caller-supplied filter, grouping or pagination bound cannot be applied to the
 * requested query. Raised while planning, before any backend is contacted.
 */
public class InvalidFilterException extends AnalyticsQueryException {

    public InvalidFilterException(String message) {
        super(message);
    }
}
