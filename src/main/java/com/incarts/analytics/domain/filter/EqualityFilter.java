package com.incarts.analytics.domain.filter;

import com.incarts.analytics.domain.schema.TableRef;
import lombok.Value;

/**
 * {@code table.column = value}, where the table is a dimension (natural key or attribute)
 * or the fact itself.
 */
@Value
public class EqualityFilter {

    TableRef table;
    String column;
    Object value;

    @Override
    public String toString() {
        return table.getTableName() + "." + column + "=" + value;
    }
}
