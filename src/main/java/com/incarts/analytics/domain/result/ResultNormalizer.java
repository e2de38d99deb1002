package com.incarts.analytics.domain.result;

import com.incarts.analytics.domain.plan.Measure;
import com.incarts.analytics.domain.plan.PlanKind;
import com.incarts.analytics.domain.plan.Projection;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.ResultShape;
import com.incarts.analytics.domain.schema.ColumnType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw executor output into an {@link ExecutionResult}.
 *
 * Measures: NULL becomes the measure's declared default, counts become {@code Long},
 * every other measure {@code Double}. Ratios default to 0.0.
 * Group and listing columns are coerced from their declared column type
 * ({@code Long}, {@code Double}, {@code Boolean}, {@code String}, {@code LocalDate},
 * {@code LocalDateTime}).
 *
 * Records keep the plan's output alias order and the row order they arrived in.
 */
@Component
public class ResultNormalizer {

    private static final Double RATIO_DEFAULT = 0.0;

    public ExecutionResult normalize(QueryPlan plan, RawResult raw) {
        if (plan.getShape() != raw.getShape()) {
            throw new IllegalStateException("Plan " + plan.getName() + " expects " + plan.getShape()
                    + " but the backend produced " + raw.getShape());
        }
        if (plan.getShape() == ResultShape.SCALAR) {
            return ExecutionResult.scalar(normalizeScalar(plan, raw.getScalar()), raw.getDegradations());
        }

        List<Map<String, Object>> records = new ArrayList<>(raw.getRows().size());
        for (Map<String, Object> row : raw.getRows()) {
            records.add(normalizeRow(plan, row));
        }
        return ExecutionResult.rows(records, raw.getDegradations());
    }

    private Object normalizeScalar(QueryPlan plan, Object value) {
        if (plan.getKind() == PlanKind.RATIO) {
            return value == null ? RATIO_DEFAULT : toDouble(value);
        }
        Measure measure = plan.primary().measure(plan.getResultAlias())
                .orElseThrow(() -> new IllegalStateException("Plan " + plan.getName() + " has no scalar measure"));
        return normalizeMeasure(measure, value);
    }

    private Map<String, Object> normalizeRow(QueryPlan plan, Map<String, Object> row) {
        Map<String, Object> record = new LinkedHashMap<>();
        if (plan.getKind() == PlanKind.LISTING) {
            for (Projection selection : plan.getSelections()) {
                record.put(selection.getAlias(), coerce(selection.getColumn().getType(), lookup(row, selection.getAlias())));
            }
            return record;
        }
        for (Projection group : plan.getGroupBy()) {
            record.put(group.getAlias(), coerce(group.getColumn().getType(), lookup(row, group.getAlias())));
        }
        for (Measure measure : plan.primary().getMeasures()) {
            record.put(measure.getAlias(), normalizeMeasure(measure, lookup(row, measure.getAlias())));
        }
        return record;
    }

    Object normalizeMeasure(Measure measure, Object value) {
        if (value == null) {
            return measure.getDefaultValue();
        }
        if (measure.getKind().isCount()) {
            return toLong(value);
        }
        return toDouble(value);
    }

    /**
     * JDBC drivers may fold unquoted aliases to upper case; PostgREST returns them as named.
     */
    private Object lookup(Map<String, Object> row, String alias) {
        if (row.containsKey(alias)) {
            return row.get(alias);
        }
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(alias)) {
                return entry.getValue();
            }
        }
        return null;
    }

    Object coerce(ColumnType type, Object value) {
        if (value == null) {
            return null;
        }
        switch (type) {
            case STRING:
                return value.toString();
            case INTEGER:
                return toLong(value);
            case DECIMAL:
                return toDouble(value);
            case BOOLEAN:
                return value instanceof Boolean ? value : Boolean.valueOf(value.toString().toLowerCase(Locale.ROOT));
            case DATE:
                return toLocalDate(value);
            case TIMESTAMP:
                return toLocalDateTime(value);
            default:
                throw new IllegalArgumentException("Unhandled column type " + type);
        }
    }

    private Long toLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return new BigDecimal(value.toString().trim()).longValue();
    }

    private Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return new BigDecimal(value.toString().trim()).doubleValue();
    }

    private LocalDate toLocalDate(Object value) {
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toLocalDate();
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toLocalDate();
        }
        String text = value.toString().trim();
        return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
    }

    private LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toLocalDateTime();
        }
        String text = value.toString().trim().replace(' ', 'T');
        try {
            return OffsetDateTime.parse(text).toLocalDateTime();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text);
        }
    }
}
