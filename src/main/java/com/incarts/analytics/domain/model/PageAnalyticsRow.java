package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Visits and link clicks of one landing page. {@code ctr} is clicks per 100 visits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageAnalyticsRow {

    private String pageUrl;
    private String pageTitle;
    private long visits;
    private long clicks;
    private double ctr;
    private Double avgTimeOnPage;
}
