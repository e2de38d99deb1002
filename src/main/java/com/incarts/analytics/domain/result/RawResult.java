package com.incarts.analytics.domain.result;

import com.incarts.analytics.domain.plan.ResultShape;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Backend output before normalization: row maps keyed as the backend returned them, or
 * a single value that may be NULL.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RawResult {

    ResultShape shape;
    Object scalar;
    List<Map<String, Object>> rows;
    List<DegradedLookup> degradations;

    public static RawResult scalar(Object value) {
        return scalar(value, Collections.emptyList());
    }

    public static RawResult scalar(Object value, List<DegradedLookup> degradations) {
        return new RawResult(ResultShape.SCALAR, value, Collections.emptyList(), List.copyOf(degradations));
    }

    public static RawResult rows(List<Map<String, Object>> rows) {
        return rows(rows, Collections.emptyList());
    }

    public static RawResult rows(List<Map<String, Object>> rows, List<DegradedLookup> degradations) {
        return new RawResult(ResultShape.ROWS, null, rows, List.copyOf(degradations));
    }
}
