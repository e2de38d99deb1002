package com.incarts.analytics.infrastructure.emulated;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One single-table request: projection, AND-ed filters, and either an exact count or
 * a (possibly ordered and windowed) row fetch.
 */
@Value
@Builder(toBuilder = true)
public class TableQuery {

    String table;
    @Singular
    List<String> columns;
    @Singular
    List<TableFilter> filters;
    boolean countOnly;
    @Singular("order")
    List<TableOrder> ordering;
    Integer limit;
    Integer offset;
}
