package com.incarts.analytics.domain.exception;

import com.incarts.analytics.domain.executor.ExecutorKind;
import lombok.Getter;

/**
 * Transport, syntax or timeout failure reported by a backend. Never retried by the
 * executors themselves.
 */
@Getter
public class BackendQueryException extends AnalyticsQueryException {

    private final ExecutorKind executorKind;
    private final boolean timeout;

    public BackendQueryException(ExecutorKind executorKind, String message, Throwable cause) {
        this(executorKind, message, cause, false);
    }

    public BackendQueryException(ExecutorKind executorKind, String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.executorKind = executorKind;
        this.timeout = timeout;
    }
}
