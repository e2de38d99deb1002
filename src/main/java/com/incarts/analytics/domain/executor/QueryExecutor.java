package com.incarts.analytics.domain.executor;

import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.result.ExecutionResult;

/**
 * Runs a {@link QueryPlan} against one backend.
 *
 * Implementations apply a per-call timeout, never retry, and report failures as
 * {@code BackendQueryException}. Plans they cannot represent are rejected with
 * {@code UnsupportedPlanException}.
 */
public interface QueryExecutor {

    ExecutorKind kind();

    ExecutionResult execute(QueryPlan plan);
}
