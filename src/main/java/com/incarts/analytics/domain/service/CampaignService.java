package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.exception.InvalidFilterException;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.ClickLogRow;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.LinkPerformanceInCampaignRow;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.plan.QueryTemplate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

import static com.incarts.analytics.domain.catalog.AnalyticsTemplates.ATC_FLAG;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK_CLICKS;

/**
 * Reports scoped to one campaign, addressed by its natural key.
 */
@Service
@RequiredArgsConstructor
public class CampaignService {

    private static final Map<String, String> UTM_COLUMNS = Map.of(
            "source", "utm_source",
            "medium", "utm_medium",
            "content", "utm_content",
            "term", "utm_term",
            "campaign_name", "utm_campaign");

    private final AnalyticsQueryService queryService;

    public KpiResponse totalClicks(String campaignKey, AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_CLICKS, campaignKey, request);
    }

    public KpiResponse totalAtcClicks(String campaignKey, AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_ATC_CLICKS, campaignKey, request);
    }

    public KpiResponse totalLinkValue(String campaignKey, AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_LINK_VALUE, campaignKey, request);
    }

    public KpiResponse totalPageVisits(String campaignKey, AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.TOTAL_PAGE_VISITS, campaignKey, request);
    }

    public KpiResponse pageCtr(String campaignKey, AnalyticsQueryRequest request) {
        return kpi(AnalyticsTemplates.PAGE_CTR, campaignKey, request);
    }

    public TrendResponse clickTrends(String campaignKey, AnalyticsQueryRequest request) {
        return TrendResponse.builder()
                .data(queryService.trend(AnalyticsTemplates.CLICK_TRENDS,
                        filters(campaignKey, request).build(), "total_clicks"))
                .build();
    }

    public BreakdownResponse utmPerformance(String campaignKey, String utmParameter, AnalyticsQueryRequest request) {
        String column = UTM_COLUMNS.get(utmParameter);
        if (column == null) {
            throw new InvalidFilterException("Invalid utm_parameter '" + utmParameter
                    + "'. Allowed values: source, medium, content, term, campaign_name");
        }
        FilterSet filters = filters(campaignKey, request).groupBy(LINK_CLICKS, column).build();
        return BreakdownResponse.builder()
                .data(queryService.breakdown(AnalyticsTemplates.UTM_PERFORMANCE, filters, "total_clicks"))
                .build();
    }

    public PaginatedResponse<LinkPerformanceInCampaignRow> linkPerformance(String campaignKey,
                                                                          AnalyticsQueryRequest request) {
        return queryService.paginated(AnalyticsTemplates.LINK_PERFORMANCE_COUNT, AnalyticsTemplates.LINK_PERFORMANCE,
                filters(campaignKey, request), request,
                row -> LinkPerformanceInCampaignRow.builder()
                        .linkName(ReportRows.string(row, "link_name"))
                        .shortLinkUrl(ReportRows.string(row, "short_link_url"))
                        .linkType(ReportRows.string(row, "link_type"))
                        .totalClicks(ReportRows.longValue(row, "total_clicks"))
                        .atcClicks(ReportRows.longValue(row, "atc_clicks"))
                        .totalLinkValue(ReportRows.doubleValue(row, "total_link_value"))
                        .build());
    }

    /**
     * Raw clicks of the campaign, newest first.
     */
    public PaginatedResponse<ClickLogRow> clickLog(String campaignKey, AnalyticsQueryRequest request) {
        return queryService.paginated(AnalyticsTemplates.CLICK_LOG_COUNT, AnalyticsTemplates.CLICK_LOG,
                filters(campaignKey, request), request,
                row -> ClickLogRow.builder()
                        .clickId(ReportRows.longValue(row, "click_id"))
                        .clickTimestamp(ReportRows.timestamp(row, "click_timestamp"))
                        .utmSource(ReportRows.string(row, "utm_source"))
                        .utmMedium(ReportRows.string(row, "utm_medium"))
                        .utmCampaign(ReportRows.string(row, "utm_campaign"))
                        .atcClick(ReportRows.flag(row, ATC_FLAG))
                        .clickValue(ReportRows.doubleValue(row, "click_value"))
                        .build());
    }

    private KpiResponse kpi(QueryTemplate template, String campaignKey, AnalyticsQueryRequest request) {
        return queryService.kpi(template, filters(campaignKey, request).build());
    }

    private FilterSet.Builder filters(String campaignKey, AnalyticsQueryRequest request) {
        return request.filters().equalTo(AnalyticsTemplates.CAMPAIGN_KEY.getTable(),
                AnalyticsTemplates.CAMPAIGN_KEY.getColumn(), campaignKey);
    }
}
