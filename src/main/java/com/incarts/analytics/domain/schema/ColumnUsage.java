package com.incarts.analytics.domain.schema;

public enum ColumnUsage {
    FILTER,
    GROUP
}
