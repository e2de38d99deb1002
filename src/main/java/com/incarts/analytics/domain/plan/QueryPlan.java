package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.filter.Pagination;
import com.incarts.analytics.domain.schema.FactRef;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Backend-neutral description of one query, produced by {@link QueryPlanBuilder} and
 * consumed once by an executor.
 *
 * Parameter positions are 1-based and contiguous across all branches, in branch order.
 * Pagination is only present on row plans.
 */
@Value
@Builder
public class QueryPlan {

    String name;
    PlanKind kind;
    ResultShape shape;
    List<PlanBranch> branches;
    List<Projection> groupBy;
    List<Projection> selections;
    List<OrderBy> orderBy;
    Pagination pagination;
    List<Object> parameters;
    /** Output name of a ratio or of a scalar plan's measure. */
    String resultAlias;

    public PlanBranch primary() {
        return branches.get(0);
    }

    public FactRef fact() {
        return primary().getFact();
    }

    public boolean isGrouped() {
        return !groupBy.isEmpty();
    }

    public Optional<Pagination> pagination() {
        return Optional.ofNullable(pagination);
    }

    public Object parameter(int paramIndex) {
        if (paramIndex < 1 || paramIndex > parameters.size()) {
            throw new IllegalArgumentException("No parameter at position " + paramIndex + " in plan " + name);
        }
        return parameters.get(paramIndex - 1);
    }

    public Object parameter(Predicate predicate) {
        return parameter(predicate.getParamIndex());
    }

    /**
     * Output aliases in row order: group keys or listing columns first, then measures.
     */
    public List<String> outputAliases() {
        List<String> aliases = new ArrayList<>();
        if (kind == PlanKind.LISTING) {
            selections.forEach(selection -> aliases.add(selection.getAlias()));
            return aliases;
        }
        if (kind == PlanKind.RATIO) {
            aliases.add(resultAlias);
            return aliases;
        }
        groupBy.forEach(group -> aliases.add(group.getAlias()));
        primary().getMeasures().forEach(measure -> aliases.add(measure.getAlias()));
        return aliases;
    }
}
