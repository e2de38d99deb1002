package com.incarts.analytics.domain.plan;

public enum MeasureKind {
    COUNT,
    /** Rows whose boolean flag column is TRUE. */
    COUNT_IF,
    COUNT_DISTINCT,
    SUM,
    AVG,
    /** Another measure as a percentage of a third one, computed per output row. */
    RATE;

    public boolean isCount() {
        return this == COUNT || this == COUNT_IF || this == COUNT_DISTINCT;
    }
}
