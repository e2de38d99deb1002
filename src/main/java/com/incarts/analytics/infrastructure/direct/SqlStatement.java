package com.incarts.analytics.infrastructure.direct;

import lombok.Value;

import java.util.List;

/**
 * SQL text with {@code ?} placeholders and the values to bind, in placeholder order.
 */
@Value
public class SqlStatement {

    String sql;
    List<Object> parameters;
}
