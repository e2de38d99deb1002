package com.incarts.analytics.domain.plan;

public enum ResultShape {
    SCALAR,
    ROWS
}
