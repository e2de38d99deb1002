package com.incarts.analytics.domain.filter;

import lombok.Value;

/**
 * Boolean predicate on a fact column, e.g. add-to-cart clicks only.
 */
@Value
public class FlagFilter {

    String column;
    boolean value;

    @Override
    public String toString() {
        return column + "=" + value;
    }
}
