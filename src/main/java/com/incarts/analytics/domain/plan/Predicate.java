package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.schema.ColumnRef;
import com.incarts.analytics.domain.schema.TableRef;
import lombok.Value;

/**
 * A WHERE clause term. Bound operators carry the 1-based position of their value in
 * {@link QueryPlan#getParameters()}; {@code NOT_NULL} carries 0.
 */
@Value
public class Predicate {

    TableRef table;
    ColumnRef column;
    PredicateOperator operator;
    int paramIndex;

    public static Predicate bound(TableRef table, ColumnRef column, PredicateOperator operator, int paramIndex) {
        return new Predicate(table, column, operator, paramIndex);
    }

    public static Predicate notNull(TableRef table, ColumnRef column) {
        return new Predicate(table, column, PredicateOperator.NOT_NULL, 0);
    }

    public boolean isBound() {
        return operator.isBound();
    }
}
