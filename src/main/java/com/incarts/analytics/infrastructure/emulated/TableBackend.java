package com.incarts.analytics.infrastructure.emulated;

/**
 * Table-scoped select/filter/count primitive. No joins, no grouping.
 */
public interface TableBackend {

    TableResult select(TableQuery query);

    BackendCapabilities capabilities();
}
