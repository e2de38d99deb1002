package com.incarts.analytics.domain.plan;

public enum PlanKind {
    /** Measures over one fact, optionally grouped. */
    AGGREGATE,
    /** First branch's measure as a percentage of the second branch's measure. */
    RATIO,
    /** Raw fact rows, ordered and paginated. */
    LISTING
}
