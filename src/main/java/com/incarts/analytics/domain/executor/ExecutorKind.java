package com.incarts.analytics.domain.executor;

public enum ExecutorKind {
    /** Arbitrary SQL over a relational connection. */
    DIRECT,
    /** Single-table filter/select/count primitives over a REST data API. */
    EMULATED
}
