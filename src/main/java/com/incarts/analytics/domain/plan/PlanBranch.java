package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.schema.DimensionRef;
import com.incarts.analytics.domain.schema.FactRef;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * One single-fact sub-query of a plan: the joins it needs, its WHERE terms and its
 * measures. Ratio plans have two branches, everything else has one.
 */
@Value
public class PlanBranch {

    String name;
    FactRef fact;
    List<DimensionRef> joins;
    List<Predicate> predicates;
    List<Measure> measures;

    public boolean joins(DimensionRef dimension) {
        return joins.contains(dimension);
    }

    public Optional<Measure> measure(String alias) {
        return measures.stream()
                .filter(measure -> measure.getAlias().equals(alias))
                .findFirst();
    }
}
