package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.ProductPerformanceRow;
import com.incarts.analytics.domain.model.TrendResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

import static com.incarts.analytics.domain.schema.WarehouseSchema.PRODUCT;

@Service
@RequiredArgsConstructor
public class ProductService {

    private final AnalyticsQueryService queryService;

    public PaginatedResponse<ProductPerformanceRow> performance(AnalyticsQueryRequest request) {
        return productTable(request.filters(), request, queryService);
    }

    public KpiResponse clicks(String productId, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_CLICKS, byProduct(productId, request));
    }

    public KpiResponse atcClicks(String productId, AnalyticsQueryRequest request) {
        return queryService.kpi(AnalyticsTemplates.TOTAL_ATC_CLICKS, byProduct(productId, request));
    }

    public TrendResponse clickTrends(String productId, AnalyticsQueryRequest request) {
        return TrendResponse.builder()
                .data(queryService.trend(AnalyticsTemplates.CLICK_TRENDS, byProduct(productId, request),
                        "total_clicks"))
                .build();
    }

    static PaginatedResponse<ProductPerformanceRow> productTable(FilterSet.Builder filters,
                                                                 AnalyticsQueryRequest request,
                                                                 AnalyticsQueryService queryService) {
        return queryService.paginated(AnalyticsTemplates.PRODUCT_PERFORMANCE_COUNT,
                AnalyticsTemplates.PRODUCT_PERFORMANCE, filters, request, ProductService::toProductRow);
    }

    private static ProductPerformanceRow toProductRow(Map<String, Object> row) {
        return ProductPerformanceRow.builder()
                .productName(ReportRows.string(row, "product_name"))
                .productId(ReportRows.string(row, "product_id"))
                .clicks(ReportRows.longValue(row, "clicks"))
                .atcClicks(ReportRows.longValue(row, "atc_clicks"))
                .conversionRate(ReportRows.doubleValue(row, "conversion_rate"))
                .estimatedValue(ReportRows.doubleValue(row, "estimated_value"))
                .build();
    }

    private FilterSet byProduct(String productId, AnalyticsQueryRequest request) {
        return request.filters().equalTo(PRODUCT, "product_id", productId).build();
    }
}
