package com.incarts.analytics.domain.schema;

import java.util.List;
import java.util.Optional;

/**
 * Common view of fact and dimension tables.
 */
public interface TableRef {

    String getTableName();

    String getAlias();

    /**
     * Surrogate key for dimensions, primary key for facts.
     */
    String getKeyColumn();

    List<ColumnRef> getColumns();

    default Optional<ColumnRef> findColumn(String name) {
        return getColumns().stream()
                .filter(column -> column.getName().equals(name))
                .findFirst();
    }

    default ColumnRef column(String name) {
        return findColumn(name).orElseThrow(() ->
                new IllegalArgumentException("Unknown column " + getTableName() + "." + name));
    }
}
