package com.incarts.analytics.domain.plan;

import lombok.Builder;
import lombok.Value;

/**
 * One aggregate output column of a plan branch, always computed over the branch's fact.
 *
 * {@code defaultValue} replaces a missing or NULL aggregate in the normalized result:
 * zero for counts, 0.0 for sums and rates. Averages keep NULL.
 */
@Value
@Builder
public class Measure {

    String alias;
    MeasureKind kind;
    /** Fact column; COUNT falls back to the fact's primary key when absent. */
    String column;
    String numerator;
    String denominator;
    Object defaultValue;

    public static Measure count(String alias) {
        return Measure.builder().alias(alias).kind(MeasureKind.COUNT).defaultValue(0L).build();
    }

    public static Measure countIf(String alias, String flagColumn) {
        return Measure.builder().alias(alias).kind(MeasureKind.COUNT_IF).column(flagColumn).defaultValue(0L).build();
    }

    public static Measure countDistinct(String alias, String column) {
        return Measure.builder().alias(alias).kind(MeasureKind.COUNT_DISTINCT).column(column).defaultValue(0L).build();
    }

    public static Measure sum(String alias, String column) {
        return Measure.builder().alias(alias).kind(MeasureKind.SUM).column(column).defaultValue(0.0).build();
    }

    public static Measure avg(String alias, String column) {
        return Measure.builder().alias(alias).kind(MeasureKind.AVG).column(column).build();
    }

    public static Measure rate(String alias, String numeratorAlias, String denominatorAlias) {
        return Measure.builder()
                .alias(alias)
                .kind(MeasureKind.RATE)
                .numerator(numeratorAlias)
                .denominator(denominatorAlias)
                .defaultValue(0.0)
                .build();
    }
}
