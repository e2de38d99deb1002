package com.incarts.analytics.infrastructure.direct;

import java.util.List;
import java.util.Map;

/**
 * Minimal contract of a connection able to run arbitrary parameterized SQL.
 */
public interface SqlBackend {

    List<Map<String, Object>> fetch(SqlStatement statement);

    /**
     * First column of the first row, or null when the statement returns no rows.
     */
    Object fetchScalar(SqlStatement statement);
}
