package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.schema.ColumnRef;
import com.incarts.analytics.domain.schema.TableRef;
import lombok.Value;

/**
 * A column emitted under an output alias, either as a grouping key or as a raw
 * listing column.
 */
@Value
public class Projection {

    TableRef table;
    ColumnRef column;
    String alias;

    public static Projection of(TableRef table, String column, String alias) {
        return new Projection(table, table.column(column), alias);
    }
}
