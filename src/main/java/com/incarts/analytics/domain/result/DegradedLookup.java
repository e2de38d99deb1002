package com.incarts.analytics.domain.result;

import lombok.Value;

/**
 * A dimension lookup that failed inside the emulated executor and was treated as
 * "no matching keys". A result carrying one may under-count.
 */
@Value
public class DegradedLookup {

    String table;
    String column;
    String reason;
}
