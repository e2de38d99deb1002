package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.filter.ColumnSelector;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * A named, reusable query shape. Combined with a request's {@code FilterSet} it yields
 * a {@link QueryPlan}.
 *
 * A template with a {@code denominator} branch is a ratio; one with {@code selections}
 * is a listing; anything else aggregates {@code primary}'s measures.
 */
@Value
@Builder
public class QueryTemplate {

    String name;
    @Builder.Default
    ResultShape shape = ResultShape.SCALAR;
    BranchTemplate primary;
    BranchTemplate denominator;
    String ratioAlias;

    /** Equality filters a request must supply, e.g. the campaign of a campaign page. */
    @Singular
    List<ColumnSelector> requiredFilters;
    boolean dateRangeRequired;

    @Singular
    List<Projection> fixedGroups;
    /** Columns a request may pick as its extra grouping key, emitted as {@code selectorAlias}. */
    @Singular
    List<ColumnSelector> selectableGroups;
    String selectorAlias;
    boolean selectorRequired;
    boolean excludeNullGroups;

    @Singular
    List<Projection> selections;
    @Singular("orderBy")
    List<OrderBy> ordering;

    public PlanKind kind() {
        if (denominator != null) {
            return PlanKind.RATIO;
        }
        if (!selections.isEmpty()) {
            return PlanKind.LISTING;
        }
        return PlanKind.AGGREGATE;
    }

    public Optional<BranchTemplate> denominatorBranch() {
        return Optional.ofNullable(denominator);
    }
}
