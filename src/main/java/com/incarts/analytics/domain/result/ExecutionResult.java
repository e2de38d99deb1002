package com.incarts.analytics.domain.result;

import com.incarts.analytics.domain.plan.ResultShape;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Backend-agnostic outcome of one plan: a single value or an ordered list of flat records.
 * Callers cannot tell which executor produced it, except through {@link #isDegraded()}.
 */
public abstract class ExecutionResult {

    private final List<DegradedLookup> degradations;

    protected ExecutionResult(List<DegradedLookup> degradations) {
        this.degradations = degradations == null ? Collections.emptyList() : List.copyOf(degradations);
    }

    public static Scalar scalar(Object value, List<DegradedLookup> degradations) {
        return new Scalar(value, degradations);
    }

    public static Rows rows(List<Map<String, Object>> records, List<DegradedLookup> degradations) {
        return new Rows(records, degradations);
    }

    public abstract ResultShape shape();

    public List<DegradedLookup> getDegradations() {
        return degradations;
    }

    public boolean isDegraded() {
        return !degradations.isEmpty();
    }

    public Scalar asScalar() {
        if (!(this instanceof Scalar)) {
            throw new IllegalStateException("Expected a scalar result but got " + shape());
        }
        return (Scalar) this;
    }

    public Rows asRows() {
        if (!(this instanceof Rows)) {
            throw new IllegalStateException("Expected a row result but got " + shape());
        }
        return (Rows) this;
    }

    public static final class Scalar extends ExecutionResult {

        private final Object value;

        private Scalar(Object value, List<DegradedLookup> degradations) {
            super(degradations);
            this.value = value;
        }

        @Override
        public ResultShape shape() {
            return ResultShape.SCALAR;
        }

        public Object getValue() {
            return value;
        }

        public long longValue() {
            return value == null ? 0L : ((Number) value).longValue();
        }

        public double doubleValue() {
            return value == null ? 0.0 : ((Number) value).doubleValue();
        }

        @Override
        public String toString() {
            return "Scalar[" + value + "]";
        }
    }

    public static final class Rows extends ExecutionResult {

        private final List<Map<String, Object>> records;

        private Rows(List<Map<String, Object>> records, List<DegradedLookup> degradations) {
            super(degradations);
            this.records = Collections.unmodifiableList(records);
        }

        @Override
        public ResultShape shape() {
            return ResultShape.ROWS;
        }

        public List<Map<String, Object>> getRecords() {
            return records;
        }

        public int size() {
            return records.size();
        }

        public boolean isEmpty() {
            return records.isEmpty();
        }

        @Override
        public String toString() {
            return "Rows[" + records.size() + "]";
        }
    }
}
