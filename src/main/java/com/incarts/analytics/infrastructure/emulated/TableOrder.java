package com.incarts.analytics.infrastructure.emulated;

import lombok.Value;

@Value
public class TableOrder {

    String column;
    boolean descending;
}
