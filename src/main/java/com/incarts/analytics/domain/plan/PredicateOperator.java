package com.incarts.analytics.domain.plan;

public enum PredicateOperator {
    EQ("="),
    GTE(">="),
    LTE("<="),
    NOT_NULL("IS NOT NULL");

    private final String sql;

    PredicateOperator(String sql) {
        this.sql = sql;
    }

    public String sql() {
        return sql;
    }

    public boolean isBound() {
        return this != NOT_NULL;
    }
}
