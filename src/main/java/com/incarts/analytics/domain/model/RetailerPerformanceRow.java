package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetailerPerformanceRow {

    private String retailerName;
    private long clicks;
    private long atcClicks;
    private double conversionRate;
    private double estimatedValue;
}
