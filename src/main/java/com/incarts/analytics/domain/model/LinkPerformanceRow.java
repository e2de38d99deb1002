package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LinkPerformanceRow {

    private String linkName;
    private String shortLinkUrl;
    private String linkType;
    private long totalClicks;
    private long atcClicks;
    private double totalLinkValue;
    private Double conversionRate;
}
