package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.LinkPerformanceRow;
import com.incarts.analytics.domain.model.MultiTrendResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK;

/**
 * Link reports across all campaigns, optionally narrowed to one link type.
 */
@Service
@RequiredArgsConstructor
public class LinkService {

    private final AnalyticsQueryService queryService;

    public KpiResponse totalClicks(String linkType, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_CLICKS, byLinkType(linkType, request).build());
    }

    public KpiResponse totalAtcClicks(String linkType, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_ATC_CLICKS, byLinkType(linkType, request).build());
    }

    public KpiResponse conversionRate(String linkType, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.CONVERSION_RATE, byLinkType(linkType, request).build());
    }

    public MultiTrendResponse clickTrends(AnalyticsQueryRequest request, boolean breakdownByLinkType) {
        FilterSet.Builder filters = request.filters();
        if (breakdownByLinkType) {
            filters.groupBy(LINK, "link_type_name");
        }
        return MultiTrendResponse.builder()
                .series(queryService.trendSeries(AnalyticsTemplates.OVERVIEW_CLICK_TRENDS, filters.build(),
                        "total_clicks", OverviewService.OVERALL_SERIES))
                .build();
    }

    public PaginatedResponse<LinkPerformanceRow> performance(String linkType, AnalyticsQueryRequest request) {
        return queryService.paginated(AnalyticsTemplates.LINK_PERFORMANCE_COUNT, AnalyticsTemplates.LINK_PERFORMANCE,
                byLinkType(linkType, request), request,
                row -> LinkPerformanceRow.builder()
                        .linkName(ReportRows.string(row, "link_name"))
                        .shortLinkUrl(ReportRows.string(row, "short_link_url"))
                        .linkType(ReportRows.string(row, "link_type"))
                        .totalClicks(ReportRows.longValue(row, "total_clicks"))
                        .atcClicks(ReportRows.longValue(row, "atc_clicks"))
                        .totalLinkValue(ReportRows.doubleValue(row, "total_link_value"))
                        .conversionRate(ReportRows.nullableDouble(row, "conversion_rate"))
                        .build());
    }

    public KpiResponse linkClicks(String linkKey, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_CLICKS, byLink(linkKey, request));
    }

    public TrendResponse linkClickTrends(String linkKey, AnalyticsQueryRequest request) {
        return TrendResponse.builder()
                .data(queryService.trend(AnalyticsTemplates.CLICK_TRENDS, byLink(linkKey, request), "total_clicks"))
                .build();
    }

    private FilterSet.Builder byLinkType(String linkType, AnalyticsQueryRequest request) {
        return request.filters().equalTo(LINK, "link_type_name", linkType);
    }

    private FilterSet byLink(String linkKey, AnalyticsQueryRequest request) {
        return request.filters().equalTo(LINK, "link_natural_key", linkKey).build();
    }
}
