package com.incarts.analytics.domain.exception;

import com.incarts.analytics.domain.executor.ExecutorKind;

/**
 * The connection or client for a backend could not be constructed or is not configured.
 */
public class BackendUnavailableException extends BackendQueryException {

    public BackendUnavailableException(ExecutorKind executorKind, String message) {
        super(executorKind, message, null);
    }

    public BackendUnavailableException(ExecutorKind executorKind, String message, Throwable cause) {
        super(executorKind, message, cause);
    }
}
