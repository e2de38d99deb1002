package com.incarts.analytics.domain.schema;

public enum DimensionKind {
    CAMPAIGN,
    LINK,
    PAGE,
    PRODUCT,
    RETAILER,
    LOCATION,
    DEVICE,
    DATE
}
