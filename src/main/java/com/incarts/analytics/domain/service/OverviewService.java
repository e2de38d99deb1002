package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.exception.InvalidFilterException;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.GeoHotspotItem;
import com.incarts.analytics.domain.model.GeoHotspotsResponse;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.MultiTrendResponse;
import com.incarts.analytics.domain.plan.QueryTemplate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

import static com.incarts.analytics.domain.catalog.AnalyticsTemplates.GEO_NAME;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;

/**
 * Account-wide dashboard: headline KPIs and the overview charts.
 */
@Service
@RequiredArgsConstructor
public class OverviewService {

    static final String OVERALL_SERIES = "Overall";

    private final AnalyticsQueryService queryService;

    public KpiResponse totalClicks(AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_CLICKS, request);
    }

    public KpiResponse totalAtcClicks(AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_ATC_CLICKS, request);
    }

    public KpiResponse totalLinkValue(AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_LINK_VALUE, request);
    }

    public KpiResponse totalPageVisits(AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_PAGE_VISITS, request);
    }

    public KpiResponse pageCtr(AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.PAGE_CTR, request);
    }

    public MultiTrendResponse clickTrends(AnalyticsQueryRequest request, boolean breakdownByLinkType) {
        FilterSet.Builder filters = request.filters();
        if (breakdownByLinkType) {
            filters.groupBy(LINK, "link_type_name");
        }
        return MultiTrendResponse.builder()
                .series(queryService.trendSeries(AnalyticsTemplates.OVERVIEW_CLICK_TRENDS, filters.build(),
                        "total_clicks", OVERALL_SERIES))
                .build();
    }

    public BreakdownResponse linkTypePerformance(AnalyticsQueryRequest request) {
        return BreakdownResponse.builder()
                .data(queryService.breakdown(AnalyticsTemplates.LINK_TYPE_PERFORMANCE,
                        request.filters().build(), "total_clicks"))
                .build();
    }

    public GeoHotspotsResponse geoHotspots(AnalyticsQueryRequest request, String geoLevel) {
        FilterSet filters = request.filters().groupBy(LOCATION, geoColumn(geoLevel)).build();
        return GeoHotspotsResponse.builder().data(geoItems(queryService, filters)).build();
    }

    /**
     * Location column for a {@code geo_level} of "country" or "state".
     */
    static String geoColumn(String geoLevel) {
        if ("country".equals(geoLevel)) {
            return "country_name";
        }
        if ("state".equals(geoLevel)) {
            return "state_name";
        }
        throw new InvalidFilterException("Invalid geo_level '" + geoLevel + "'. Must be 'country' or 'state'.");
    }

    static List<GeoHotspotItem> geoItems(AnalyticsQueryService queryService, FilterSet filters) {
        return queryService.rows(AnalyticsTemplates.GEO_HOTSPOTS, filters).getRecords().stream()
                .map(row -> GeoHotspotItem.builder()
                        .geoName(ReportRows.string(row, GEO_NAME))
                        .value(ReportRows.longValue(row, "total_clicks"))
                        .build())
                .collect(Collectors.toList());
    }

    private KpiResponse kpi(QueryTemplate template, AnalyticsQueryRequest request) {
        return queryService.kpi(template, request.filters().build());
    }
}
