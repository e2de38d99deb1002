package com.incarts.analytics.infrastructure.emulated;

public enum FilterOperator {
    EQ,
    IN,
    GTE,
    LTE,
    NOT_NULL
}
