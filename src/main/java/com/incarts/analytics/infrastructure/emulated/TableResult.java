package com.incarts.analytics.infrastructure.emulated;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@Value
public class TableResult {

    List<Map<String, Object>> rows;
    /** Exact matching row count; only set for count requests. */
    Long totalCount;

    public static TableResult count(long totalCount) {
        return new TableResult(Collections.emptyList(), totalCount);
    }

    public static TableResult rows(List<Map<String, Object>> rows) {
        return new TableResult(rows, null);
    }
}
