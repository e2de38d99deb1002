package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.Pagination;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PageAnalyticsRow;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.result.ExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.incarts.analytics.domain.schema.WarehouseSchema.PAGE;

/**
 * Landing page reports. The performance table lists every catalogued page, ranked by
 * visits in the range, with visit and click totals merged in by page key.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PageService {

    private final AnalyticsQueryService queryService;

    public KpiResponse visits(String pageKey, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_PAGE_VISITS, byPage(pageKey, request));
    }

    public KpiResponse clicks(String pageKey, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_CLICKS, byPage(pageKey, request));
    }

    public KpiResponse ctr(String pageKey, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.PAGE_CTR, byPage(pageKey, request));
    }

    public TrendResponse visitTrends(String pageKey, AnalyticsQueryRequest request) {
        return TrendResponse.builder()
                .data(queryService.trend(AnalyticsTemplates.VISIT_TRENDS, byPage(pageKey, request), "total_visits"))
                .build();
    }

    public TrendResponse clickTrends(String pageKey, AnalyticsQueryRequest request) {
        return TrendResponse.builder()
                .data(queryService.trend(AnalyticsTemplates.CLICK_TRENDS, byPage(pageKey, request), "total_clicks"))
                .build();
    }

    public PaginatedResponse<PageAnalyticsRow> performance(AnalyticsQueryRequest request) {
        Pagination pagination = request.pagination();
        ExecutionResult.Rows catalog = queryService.rows(AnalyticsTemplates.PAGE_CATALOG, FilterSet.empty());
        if (catalog.getRecords().isEmpty()) {
            return PaginatedResponse.of(List.of(), 0, request.getPage(), request.getSize(), catalog.isDegraded());
        }

        ExecutionResult.Rows visitTotals = queryService.rows(AnalyticsTemplates.PAGE_VISIT_PERFORMANCE,
                request.filters().build());
        ExecutionResult.Rows clickTotals = queryService.rows(AnalyticsTemplates.PAGE_CLICK_TOTALS,
                request.filters().build());
        Map<Long, Map<String, Object>> visitsByPage = new HashMap<>();
        for (Map<String, Object> row : visitTotals.getRecords()) {
            visitsByPage.put(ReportRows.longValue(row, "page_key"), row);
        }
        Map<Long, Long> clicksByPage = new HashMap<>();
        for (Map<String, Object> row : clickTotals.getRecords()) {
            clicksByPage.put(ReportRows.longValue(row, "page_key"), ReportRows.longValue(row, "clicks"));
        }
        log.debug("Merging {} pages with visit totals of {} and click totals of {} pages",
                catalog.getRecords().size(), visitsByPage.size(), clicksByPage.size());

        List<PageAnalyticsRow> rows = catalog.getRecords().stream()
                .map(page -> {
                    long pageKey = ReportRows.longValue(page, "page_key");
                    return toPageRow(page, visitsByPage.get(pageKey), clicksByPage.getOrDefault(pageKey, 0L));
                })
                .sorted(Comparator.comparingLong(PageAnalyticsRow::getVisits).reversed())
                .skip(pagination.getOffset())
                .limit(pagination.getLimit())
                .collect(Collectors.toList());
        boolean degraded = catalog.isDegraded() || visitTotals.isDegraded() || clickTotals.isDegraded();
        return PaginatedResponse.of(rows, catalog.getRecords().size(), request.getPage(), request.getSize(), degraded);
    }

    /**
     * Pages without visits in the range report zero visits and no average time.
     */
    private PageAnalyticsRow toPageRow(Map<String, Object> page, Map<String, Object> visitRow, long clicks) {
        long visits = visitRow == null ? 0L : ReportRows.longValue(visitRow, "visits");
        return PageAnalyticsRow.builder()
                .pageUrl(ReportRows.string(page, "page_url"))
                .pageTitle(ReportRows.string(page, "page_title"))
                .visits(visits)
                .clicks(clicks)
                .ctr(visits > 0 ? clicks * 100.0 / visits : 0.0)
                .avgTimeOnPage(visitRow == null ? null : ReportRows.nullableDouble(visitRow, "avg_time_on_page"))
                .build();
    }

    private FilterSet byPage(String pageKey, AnalyticsQueryRequest request) {
        return request.filters().equalTo(PAGE, "page_natural_key", pageKey).build();
    }
}
