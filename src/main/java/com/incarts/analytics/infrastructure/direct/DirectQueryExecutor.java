package com.incarts.analytics.infrastructure.direct;

import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import com.incarts.analytics.domain.executor.QueryExecutor;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.ResultShape;
import com.incarts.analytics.domain.result.ExecutionResult;
import com.incarts.analytics.domain.result.RawResult;
import com.incarts.analytics.domain.result.ResultNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;

import java.util.function.Supplier;

/**
 * Executes plans as a single SQL statement over a relational connection.
 */
@Slf4j
@RequiredArgsConstructor
public class DirectQueryExecutor implements QueryExecutor {

    private final Supplier<SqlBackend> backend;
    private final SqlStatementRenderer renderer;
    private final ResultNormalizer normalizer;

    @Override
    public ExecutorKind kind() {
        return ExecutorKind.DIRECT;
    }

    @Override
    public ExecutionResult execute(QueryPlan plan) {
        SqlStatement statement = renderer.render(plan);
        log.debug("Plan {} rendered with {} parameters: {}",
                plan.getName(), statement.getParameters().size(), statement.getSql());

        SqlBackend sql = backend.get();
        RawResult raw;
        try {
            raw = plan.getShape() == ResultShape.SCALAR
                    ? RawResult.scalar(sql.fetchScalar(statement))
                    : RawResult.rows(sql.fetch(statement));
        } catch (QueryTimeoutException e) {
            log.error("Direct query {} timed out", plan.getName());
            throw new BackendQueryException(ExecutorKind.DIRECT, "Query " + plan.getName() + " timed out", e, true);
        } catch (DataAccessException e) {
            log.error("Direct query {} failed: {}", plan.getName(), e.getMessage());
            throw new BackendQueryException(ExecutorKind.DIRECT, "Query " + plan.getName() + " failed", e);
        }
        return normalizer.normalize(plan, raw);
    }
}
