package com.incarts.analytics.domain.plan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Hands out parameter positions in bind order. One sequence is shared by every branch
 * of a plan, so positions never repeat and never skip.
 */
final class ParameterSequence {

    private final List<Object> values = new ArrayList<>();

    int bind(Object value) {
        values.add(value);
        return values.size();
    }

    List<Object> values() {
        return Collections.unmodifiableList(new ArrayList<>(values));
    }
}
