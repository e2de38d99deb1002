package com.incarts.analytics.domain.exception;

import com.incarts.analytics.domain.executor.ExecutorKind;
import lombok.Getter;

/**
 * An executor cannot represent the requested plan. Callers may route the plan to
 * another executor instead.
 */
@Getter
public class UnsupportedPlanException extends AnalyticsQueryException {

    private final ExecutorKind executorKind;

    public UnsupportedPlanException(ExecutorKind executorKind, String message) {
        super(message);
        this.executorKind = executorKind;
    }
}
