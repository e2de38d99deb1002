package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.ProductPerformanceRow;
import com.incarts.analytics.domain.model.RetailerPerformanceRow;
import com.incarts.analytics.domain.model.TrendResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import static com.incarts.analytics.domain.schema.WarehouseSchema.RETAILER;

/**
 * Retailer reports. Retailers are addressed by name, their natural key.
 */
@Service
@RequiredArgsConstructor
public class RetailerService {

    private final AnalyticsQueryService queryService;

    public PaginatedResponse<RetailerPerformanceRow> performance(AnalyticsQueryRequest request) {
        return queryService.paginated(AnalyticsTemplates.RETAILER_PERFORMANCE_COUNT,
                AnalyticsTemplates.RETAILER_PERFORMANCE, request.filters(), request,
                row -> RetailerPerformanceRow.builder()
                        .retailerName(ReportRows.string(row, "retailer_name"))
                        .clicks(ReportRows.longValue(row, "clicks"))
                        .atcClicks(ReportRows.longValue(row, "atc_clicks"))
                        .conversionRate(ReportRows.doubleValue(row, "conversion_rate"))
                        .estimatedValue(ReportRows.doubleValue(row, "estimated_value"))
                        .build());
    }

    public KpiResponse clicks(String retailerName, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_CLICKS, byRetailer(retailerName, request).build());
    }

    public KpiResponse atcClicks(String retailerName, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_ATC_CLICKS, byRetailer(retailerName, request).build());
    }

    public TrendResponse clickTrends(String retailerName, AnalyticsQueryRequest request) {
        return TrendResponse.builder()
                .data(queryService.trend(AnalyticsTemplates.CLICK_TRENDS, byRetailer(retailerName, request).build(),
                        "total_clicks"))
                .build();
    }

    public PaginatedResponse<ProductPerformanceRow> productPerformance(String retailerName,
                                                                      AnalyticsQueryRequest request) {
        return ProductService.productTable(byRetailer(retailerName, request), request, queryService);
    }

    private FilterSet.Builder byRetailer(String retailerName, AnalyticsQueryRequest request) {
        return request.filters().equalTo(RETAILER, "retailer_name", retailerName);
    }
}
