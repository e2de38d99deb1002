package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.filter.FlagFilter;
import com.incarts.analytics.domain.schema.DimensionRef;
import com.incarts.analytics.domain.schema.DimensionKind;
import com.incarts.analytics.domain.schema.FactRef;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * The static part of one plan branch: which fact, which joins are always present,
 * which joins a request may add, and which flags the query always applies.
 */
@Value
@Builder
public class BranchTemplate {

    FactRef fact;
    @Singular
    List<DimensionRef> mandatoryJoins;
    @Singular
    Set<DimensionRef> optionalJoins;
    @Singular
    List<FlagFilter> fixedFlags;
    @Singular
    List<Measure> measures;

    /**
     * Date is joinable whenever the fact carries a date key.
     */
    public boolean allowsJoin(DimensionRef dimension) {
        if (!fact.canJoin(dimension)) {
            return false;
        }
        return dimension.getKind() == DimensionKind.DATE
                || mandatoryJoins.contains(dimension)
                || optionalJoins.contains(dimension);
    }
}
