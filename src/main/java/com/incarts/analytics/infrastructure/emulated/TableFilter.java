package com.incarts.analytics.infrastructure.emulated;

import lombok.Value;

import java.util.Collection;
import java.util.List;

/**
 * A single-column filter understood by every {@link TableBackend}.
 */
@Value
public class TableFilter {

    String column;
    FilterOperator operator;
    Object value;

    public static TableFilter eq(String column, Object value) {
        return new TableFilter(column, FilterOperator.EQ, value);
    }

    public static TableFilter in(String column, Collection<?> values) {
        return new TableFilter(column, FilterOperator.IN, List.copyOf(values));
    }

    public static TableFilter gte(String column, Object value) {
        return new TableFilter(column, FilterOperator.GTE, value);
    }

    public static TableFilter lte(String column, Object value) {
        return new TableFilter(column, FilterOperator.LTE, value);
    }

    public static TableFilter notNull(String column) {
        return new TableFilter(column, FilterOperator.NOT_NULL, null);
    }

    public List<?> values() {
        return (List<?>) value;
    }
}
