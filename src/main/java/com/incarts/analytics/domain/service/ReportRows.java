package com.incarts.analytics.domain.service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Typed reads from normalized result records.
 */
final class ReportRows {

    private ReportRows() {
    }

    static String string(Map<String, Object> row, String alias) {
        Object value = row.get(alias);
        return value == null ? null : value.toString();
    }

    static long longValue(Map<String, Object> row, String alias) {
        Object value = row.get(alias);
        return value == null ? 0L : ((Number) value).longValue();
    }

    static double doubleValue(Map<String, Object> row, String alias) {
        Object value = row.get(alias);
        return value == null ? 0.0 : ((Number) value).doubleValue();
    }

    static Double nullableDouble(Map<String, Object> row, String alias) {
        Object value = row.get(alias);
        return value == null ? null : ((Number) value).doubleValue();
    }

    static boolean flag(Map<String, Object> row, String alias) {
        return Boolean.TRUE.equals(row.get(alias));
    }

    static LocalDate date(Map<String, Object> row, String alias) {
        return (LocalDate) row.get(alias);
    }

    static LocalDateTime timestamp(Map<String, Object> row, String alias) {
        return (LocalDateTime) row.get(alias);
    }
}
