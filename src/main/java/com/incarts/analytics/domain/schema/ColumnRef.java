package com.incarts.analytics.domain.schema;

import lombok.Value;

import java.util.Set;

/**
 * A column of a fact or dimension table.
 *
 * Derived columns carry an SQL expression template where {@code {alias}} stands for
 * the owning table's alias (e.g. the hour of a click timestamp).
 */
@Value
public class ColumnRef {

    String tableName;
    String tableAlias;
    String name;
    ColumnType type;
    Set<ColumnUsage> usages;
    String expression;

    public boolean isFilterable() {
        return usages.contains(ColumnUsage.FILTER);
    }

    public boolean isGroupable() {
        return usages.contains(ColumnUsage.GROUP);
    }

    public boolean isDerived() {
        return expression != null;
    }

    public String sqlExpression() {
        if (expression != null) {
            return expression.replace("{alias}", tableAlias);
        }
        return tableAlias + "." + name;
    }

    @Override
    public String toString() {
        return tableName + "." + name;
    }
}
