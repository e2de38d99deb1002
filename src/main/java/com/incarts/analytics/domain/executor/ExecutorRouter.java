package com.incarts.analytics.domain.executor;

import com.incarts.analytics.domain.exception.AnalyticsQueryException;
import com.incarts.analytics.domain.exception.BackendUnavailableException;
import com.incarts.analytics.domain.exception.UnsupportedPlanException;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.result.ExecutionResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tries executors in their configured order.
 *
 * An executor that declines a plan (unsupported shape, backend not available) hands it
 * to the next one. Any other backend failure is rethrown as is. When every executor
 * declines, the last decline is thrown.
 */
@Slf4j
public class ExecutorRouter implements QueryExecutor {

    private final List<QueryExecutor> executors;

    public ExecutorRouter(List<QueryExecutor> executors) {
        if (executors.isEmpty()) {
            throw new IllegalArgumentException("At least one executor is required");
        }
        this.executors = List.copyOf(executors);
    }

    @Override
    public ExecutorKind kind() {
        return executors.get(0).kind();
    }

    public List<ExecutorKind> order() {
        return executors.stream().map(QueryExecutor::kind).collect(Collectors.toList());
    }

    @Override
    public ExecutionResult execute(QueryPlan plan) {
        AnalyticsQueryException lastDecline = null;
        for (QueryExecutor executor : executors) {
            try {
                return executor.execute(plan);
            } catch (UnsupportedPlanException | BackendUnavailableException e) {
                log.warn("{} executor declined plan {}: {}", executor.kind(), plan.getName(), e.getMessage());
                lastDecline = e;
            }
        }
        throw lastDecline;
    }
}
