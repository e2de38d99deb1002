package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductPerformanceRow {

    private String productName;
    private String productId;
    private long clicks;
    private long atcClicks;
    private double conversionRate;
    private double estimatedValue;
}
