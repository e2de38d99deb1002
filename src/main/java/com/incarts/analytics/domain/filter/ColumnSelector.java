package com.incarts.analytics.domain.filter;

import com.incarts.analytics.domain.schema.TableRef;
import lombok.Value;

@Value
public class ColumnSelector {

    TableRef table;
    String column;

    @Override
    public String toString() {
        return table.getTableName() + "." + column;
    }
}
