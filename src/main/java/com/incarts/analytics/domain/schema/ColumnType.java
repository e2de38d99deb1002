package com.incarts.analytics.domain.schema;

/**
 * Value type of a warehouse column. Drives result normalization so both executors
 * hand back the same Java types for the same column.
 */
public enum ColumnType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    DATE,
    TIMESTAMP
}
