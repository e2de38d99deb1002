package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.exception.InvalidFilterException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import com.incarts.analytics.domain.executor.ExecutorRouter;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendSeries;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.result.DegradedLookup;
import com.incarts.analytics.domain.result.ExecutionResult;
import com.incarts.analytics.infrastructure.cache.QueryCacheService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.incarts.analytics.domain.schema.WarehouseSchema.CAMPAIGN;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Caching, degradation and paging behaviour around the executor router.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsQueryServiceTest {

    private static final String CACHE_KEY = "analytics:kpi:total_clicks:from=null:to=null";

    @Mock
    private ExecutorRouter executorRouter;

    @Mock
    private QueryCacheService cacheService;

    private MeterRegistry meterRegistry;
    private AnalyticsQueryService queryService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryService = new AnalyticsQueryService(new QueryPlanBuilder(), executorRouter, cacheService, meterRegistry);
        ReflectionTestUtils.setField(queryService, "cacheEnabled", true);
        ReflectionTestUtils.setField(queryService, "kpiTtl", 300L);
    }

    @Test
    void testScalar_CacheHit() {
        // Given
        when(cacheService.generateCacheKey(eq("analytics:kpi"), eq("total_clicks"), anyString())).thenReturn(CACHE_KEY);
        when(cacheService.get(CACHE_KEY, Number.class)).thenReturn(Optional.of(42L));

        // When
        ExecutionResult.Scalar result = queryService.scalar(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty());

        // Then
        assertEquals(42L, result.getValue());
        assertFalse(result.isDegraded());
        verifyNoInteractions(executorRouter);
        assertEquals(1.0, meterRegistry.counter("analytics.query.cache", "result", "hit").count());
    }

    @Test
    void testScalar_CacheMissStoresValue() {
        // Given
        when(cacheService.generateCacheKey(eq("analytics:kpi"), eq("total_clicks"), anyString())).thenReturn(CACHE_KEY);
        when(cacheService.get(CACHE_KEY, Number.class)).thenReturn(Optional.empty());
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.scalar(10L, Collections.emptyList()));

        // When
        ExecutionResult.Scalar result = queryService.scalar(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty());

        // Then
        assertEquals(10L, result.getValue());
        verify(cacheService).set(CACHE_KEY, 10L, 300L);
        assertEquals(1.0, meterRegistry.counter("analytics.query.cache", "result", "miss").count());
        assertEquals(1.0, meterRegistry.counter("analytics.query.executed",
                "template", "total_clicks", "result", "success").count());
    }

    @Test
    void testKpi_DegradedValueIsNotCached() {
        // Given
        DegradedLookup lookup = new DegradedLookup("dimcampaign", "campaign_natural_key", "status 503");
        when(cacheService.generateCacheKey(eq("analytics:kpi"), eq("total_clicks"), anyString())).thenReturn(CACHE_KEY);
        when(cacheService.get(CACHE_KEY, Number.class)).thenReturn(Optional.empty());
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.scalar(0L, List.of(lookup)));

        // When
        KpiResponse response = queryService.kpi(AnalyticsTemplates.TOTAL_CLICKS, campaign("spring-sale").build());

        // Then
        assertEquals(0L, response.getValue());
        assertEquals("total_clicks", response.getLabel());
        assertTrue(response.isDegraded());
        verify(cacheService, never()).set(anyString(), any(), anyLong());
        assertEquals(1.0, meterRegistry.counter("analytics.query.degraded", "template", "total_clicks").count());
    }

    @Test
    void testScalar_CacheDisabled() {
        // Given
        ReflectionTestUtils.setField(queryService, "cacheEnabled", false);
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.scalar(10L, Collections.emptyList()));

        // When
        queryService.scalar(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty());

        // Then
        verify(cacheService, never()).get(anyString(), any());
        verify(cacheService, never()).set(anyString(), any(), anyLong());
    }

    @Test
    void testScalar_InvalidFilterFailsBeforeBackend() {
        // When / Then
        assertThrows(InvalidFilterException.class,
                () -> queryService.scalar(AnalyticsTemplates.CLICK_LOG_COUNT, FilterSet.empty()));
        verifyNoInteractions(executorRouter, cacheService);
    }

    @Test
    void testRows_BackendFailureIsCountedAndRethrown() {
        // Given
        when(executorRouter.execute(any()))
                .thenThrow(new BackendQueryException(ExecutorKind.DIRECT, "connection reset", null));

        // When / Then
        assertThrows(BackendQueryException.class,
                () -> queryService.rows(AnalyticsTemplates.LINK_TYPE_PERFORMANCE, FilterSet.empty()));
        assertEquals(1.0, meterRegistry.counter("analytics.query.executed",
                "template", "link_type_performance", "result", "error").count());
    }

    @Test
    void testPaginated_EmptyTotalSkipsRowQuery() {
        // Given
        when(cacheService.generateCacheKey(eq("analytics:kpi"), eq("click_log_count"), anyString())).thenReturn("count-key");
        when(cacheService.get("count-key", Number.class)).thenReturn(Optional.empty());
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.scalar(0L, Collections.emptyList()));
        AnalyticsQueryRequest request = AnalyticsQueryRequest.builder().page(3).size(10).build();

        // When
        PaginatedResponse<Map<String, Object>> response = queryService.paginated(AnalyticsTemplates.CLICK_LOG_COUNT,
                AnalyticsTemplates.CLICK_LOG, campaign("no-such-campaign"), request, row -> row);

        // Then
        assertEquals(0, response.getTotalItems());
        assertTrue(response.getItems().isEmpty());
        assertEquals(3, response.getPage());
        assertEquals(0, response.getTotalPages());
        verify(executorRouter, times(1)).execute(any());
    }

    @Test
    void testPaginated_SecondPage() {
        // Given
        when(cacheService.generateCacheKey(eq("analytics:kpi"), eq("click_log_count"), anyString())).thenReturn("count-key");
        when(cacheService.get("count-key", Number.class)).thenReturn(Optional.of(25L));
        List<Map<String, Object>> page = List.of(Map.of("click_id", 1004L), Map.of("click_id", 1003L));
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.rows(page, Collections.emptyList()));
        AnalyticsQueryRequest request = AnalyticsQueryRequest.builder().page(2).size(20).build();

        // When
        PaginatedResponse<Object> response = queryService.paginated(AnalyticsTemplates.CLICK_LOG_COUNT,
                AnalyticsTemplates.CLICK_LOG, campaign("bulk-sale"), request, row -> row.get("click_id"));

        // Then
        assertEquals(25, response.getTotalItems());
        assertEquals(List.of(1004L, 1003L), response.getItems());
        assertEquals(2, response.getTotalPages());
        assertFalse(response.isDegraded());

        ArgumentCaptor<QueryPlan> plan = ArgumentCaptor.forClass(QueryPlan.class);
        verify(executorRouter).execute(plan.capture());
        assertEquals("click_log", plan.getValue().getName());
        assertEquals(20, plan.getValue().getPagination().getOffset());
        assertEquals(20, plan.getValue().getPagination().getLimit());
    }

    @Test
    void testPaginated_OversizedPageRejected() {
        // Given
        AnalyticsQueryRequest request = AnalyticsQueryRequest.builder().page(1).size(500).build();

        // When / Then
        assertThrows(InvalidFilterException.class, () -> queryService.paginated(AnalyticsTemplates.CLICK_LOG_COUNT,
                AnalyticsTemplates.CLICK_LOG, campaign("spring-sale"), request, row -> row));
        verifyNoInteractions(executorRouter, cacheService);
    }

    @Test
    void testTrendSeries_SplitBySeriesKey() {
        // Given
        LocalDate jan1 = LocalDate.of(2024, 1, 1);
        LocalDate jan2 = LocalDate.of(2024, 1, 2);
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.rows(List.of(
                Map.of("trend_date", jan1, "series_key", "Product", "total_clicks", 2L),
                Map.of("trend_date", jan2, "series_key", "Product", "total_clicks", 1L),
                Map.of("trend_date", jan2, "series_key", "Retailer", "total_clicks", 1L)), Collections.emptyList()));
        FilterSet filters = FilterSet.builder()
                .dateRange(jan1, jan2)
                .groupBy(LINK, "link_type_name")
                .build();

        // When
        List<TrendSeries> series = queryService.trendSeries(AnalyticsTemplates.OVERVIEW_CLICK_TRENDS, filters,
                "total_clicks", "Overall");

        // Then
        assertEquals(2, series.size());
        assertEquals("Product", series.get(0).getName());
        assertEquals(2, series.get(0).getData().size());
        assertEquals(jan1, series.get(0).getData().get(0).getDate());
        assertEquals("Retailer", series.get(1).getName());
        assertEquals(1L, series.get(1).getData().get(0).getValue());
    }

    @Test
    void testTrendSeries_SingleDefaultSeries() {
        // Given
        LocalDate jan1 = LocalDate.of(2024, 1, 1);
        when(executorRouter.execute(any())).thenReturn(ExecutionResult.rows(List.of(
                Map.of("trend_date", jan1, "total_clicks", 2L)), Collections.emptyList()));

        // When
        List<TrendSeries> series = queryService.trendSeries(AnalyticsTemplates.OVERVIEW_CLICK_TRENDS,
                FilterSet.builder().dateRange(jan1, jan1).build(), "total_clicks", "Overall");

        // Then
        assertEquals(1, series.size());
        assertEquals("Overall", series.get(0).getName());
        assertEquals(2L, series.get(0).getData().get(0).getValue());
    }

    private static FilterSet.Builder campaign(String naturalKey) {
        return FilterSet.builder().equalTo(CAMPAIGN, "campaign_natural_key", naturalKey);
    }
}
