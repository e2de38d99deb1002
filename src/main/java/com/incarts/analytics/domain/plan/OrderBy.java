package com.incarts.analytics.domain.plan;

import lombok.Value;

/**
 * Ordering on an output alias (group key, measure or listing column).
 */
@Value
public class OrderBy {

    String alias;
    boolean descending;

    public static OrderBy asc(String alias) {
        return new OrderBy(alias, false);
    }

    public static OrderBy desc(String alias) {
        return new OrderBy(alias, true);
    }
}
