package com.incarts.analytics.infrastructure.direct;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.Pagination;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.plan.QueryTemplate;
import com.incarts.analytics.domain.result.ExecutionResult;
import com.incarts.analytics.domain.result.ResultNormalizer;
import com.incarts.analytics.testsupport.WarehouseFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.incarts.analytics.domain.schema.WarehouseSchema.CAMPAIGN;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DirectQueryExecutorTest {

    private final QueryPlanBuilder planBuilder = new QueryPlanBuilder();

    private DirectQueryExecutor executor;

    @BeforeEach
    void setUp() {
        executor = executorOver(WarehouseFixture.standard());
    }

    @Test
    void testExecute_TotalsWithoutFilters() {
        assertEquals(10L, scalar(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty()));
        assertEquals(3L, scalar(AnalyticsTemplates.TOTAL_ATC_CLICKS, FilterSet.empty()));
        assertEquals(10.75, scalar(AnalyticsTemplates.TOTAL_LINK_VALUE, FilterSet.empty()));
        assertEquals(5L, scalar(AnalyticsTemplates.TOTAL_PAGE_VISITS, FilterSet.empty()));
    }

    @Test
    void testExecute_CampaignAndDateFilters() {
        // Given
        FilterSet springSale = campaign("spring-sale").build();
        FilterSet earlyJanuary = FilterSet.builder()
                .dateRange(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 5))
                .build();

        // Then
        assertEquals(5L, scalar(AnalyticsTemplates.TOTAL_CLICKS, springSale));
        assertEquals(2L, scalar(AnalyticsTemplates.TOTAL_ATC_CLICKS, springSale));
        assertEquals(5.0, scalar(AnalyticsTemplates.TOTAL_LINK_VALUE, springSale));
        assertEquals(5L, scalar(AnalyticsTemplates.TOTAL_CLICKS, earlyJanuary));
    }

    @Test
    void testExecute_EmptyMatchUsesMeasureDefaults() {
        // Given
        FilterSet unknown = campaign("no-such-campaign").build();

        // Then
        assertEquals(0L, scalar(AnalyticsTemplates.TOTAL_CLICKS, unknown));
        assertEquals(0.0, scalar(AnalyticsTemplates.TOTAL_LINK_VALUE, unknown));
    }

    @Test
    void testExecute_RatioOverBothFacts() {
        // When
        Object ctr = scalar(AnalyticsTemplates.PAGE_CTR, FilterSet.empty());

        // Then
        assertEquals(200.0, (Double) ctr, 0.0001);
    }

    @Test
    void testExecute_GroupedTable() {
        // When
        List<Map<String, Object>> rows = rows(AnalyticsTemplates.LINK_PERFORMANCE, FilterSet.empty());

        // Then
        assertEquals(2, rows.size());
        Map<String, Object> product = rows.get(0);
        assertEquals(1L, product.get("link_key"));
        assertEquals("Product", product.get("link_type"));
        assertEquals(5L, product.get("total_clicks"));
        assertEquals(2L, product.get("atc_clicks"));
        assertEquals(7.5, (Double) product.get("total_link_value"), 0.0001);
        assertEquals(40.0, (Double) product.get("conversion_rate"), 0.0001);

        Map<String, Object> retailer = rows.get(1);
        assertEquals(2L, retailer.get("link_key"));
        assertEquals(1L, retailer.get("atc_clicks"));
        assertEquals(20.0, (Double) retailer.get("conversion_rate"), 0.0001);
    }

    @Test
    void testExecute_GeoGroupingExcludesNullStates() {
        // When
        List<Map<String, Object>> countries = rows(AnalyticsTemplates.GEO_HOTSPOTS,
                FilterSet.builder().groupBy(LOCATION, "country_name").build());
        List<Map<String, Object>> states = rows(AnalyticsTemplates.GEO_HOTSPOTS,
                FilterSet.builder().groupBy(LOCATION, "state_name").build());

        // Then
        assertEquals(List.of(
                Map.of("geo_name", "United States", "total_clicks", 8L),
                Map.of("geo_name", "Canada", "total_clicks", 2L)), countries);
        assertEquals(List.of(
                Map.of("geo_name", "California", "total_clicks", 5L),
                Map.of("geo_name", "New York", "total_clicks", 3L)), states);
    }

    @Test
    void testExecute_TrendRowsAreDatesInOrder() {
        // When
        List<Map<String, Object>> rows = rows(AnalyticsTemplates.CLICK_TRENDS, campaign("spring-sale").build());

        // Then
        assertEquals(4, rows.size());
        assertEquals(LocalDate.of(2024, 1, 1), rows.get(0).get("trend_date"));
        assertEquals(2L, rows.get(0).get("total_clicks"));
        assertEquals(LocalDate.of(2024, 1, 5), rows.get(3).get("trend_date"));
    }

    @Test
    void testExecute_TimeOfDayBuckets() {
        // When
        List<Map<String, Object>> rows = rows(AnalyticsTemplates.TIME_OF_DAY, FilterSet.empty());

        // Then
        assertEquals(List.of(
                Map.of("category", 9L, "total_clicks", 2L),
                Map.of("category", 10L, "total_clicks", 4L),
                Map.of("category", 11L, "total_clicks", 4L)), rows);
    }

    @Test
    void testExecute_ListingSecondPage() {
        // Given
        executor = executorOver(WarehouseFixture.standard().bulkCampaign(4, "bulk-sale", 25));
        FilterSet filters = campaign("bulk-sale").pagination(Pagination.ofPage(2, 20)).build();

        // When
        List<Map<String, Object>> rows = rows(AnalyticsTemplates.CLICK_LOG, filters);

        // Then
        assertEquals(5, rows.size());
        assertEquals(1004L, rows.get(0).get("click_id"));
        assertEquals(LocalDateTime.of(2024, 1, 15, 12, 4), rows.get(0).get("click_timestamp"));
        assertEquals(1000L, rows.get(4).get("click_id"));
        assertEquals(Boolean.TRUE, rows.get(4).get("is_atc_click"));
        assertEquals("bulk", rows.get(4).get("utm_source"));
    }

    @Test
    void testExecute_TimeoutIsReported() {
        // Given
        SqlBackend backend = mock(SqlBackend.class);
        when(backend.fetchScalar(any())).thenThrow(new QueryTimeoutException("canceling statement"));
        DirectQueryExecutor failing = new DirectQueryExecutor(() -> backend,
                new SqlStatementRenderer(), new ResultNormalizer());
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty());

        // When
        BackendQueryException exception = assertThrows(BackendQueryException.class, () -> failing.execute(plan));

        // Then
        assertTrue(exception.isTimeout());
        assertEquals(ExecutorKind.DIRECT, exception.getExecutorKind());
    }

    @Test
    void testExecute_DataAccessFailureIsReported() {
        // Given
        SqlBackend backend = mock(SqlBackend.class);
        when(backend.fetch(any())).thenThrow(new DataIntegrityViolationException("relation does not exist"));
        DirectQueryExecutor failing = new DirectQueryExecutor(() -> backend,
                new SqlStatementRenderer(), new ResultNormalizer());
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.LINK_TYPE_PERFORMANCE, FilterSet.empty());

        // When
        BackendQueryException exception = assertThrows(BackendQueryException.class, () -> failing.execute(plan));

        // Then
        assertFalse(exception.isTimeout());
        assertInstanceOf(DataIntegrityViolationException.class, exception.getCause());
    }

    private static DirectQueryExecutor executorOver(WarehouseFixture fixture) {
        JdbcTemplate jdbcTemplate = WarehouseFixture.newDatabase();
        fixture.loadInto(jdbcTemplate);
        JdbcSqlBackend backend = new JdbcSqlBackend(jdbcTemplate);
        return new DirectQueryExecutor(() -> backend, new SqlStatementRenderer(), new ResultNormalizer());
    }

    private static FilterSet.Builder campaign(String naturalKey) {
        return FilterSet.builder().equalTo(CAMPAIGN, "campaign_natural_key", naturalKey);
    }

    private Object scalar(QueryTemplate template, FilterSet filters) {
        ExecutionResult result = executor.execute(planBuilder.build(template, filters));
        assertFalse(result.isDegraded());
        return result.asScalar().getValue();
    }

    private List<Map<String, Object>> rows(QueryTemplate template, FilterSet filters) {
        return executor.execute(planBuilder.build(template, filters)).asRows().getRecords();
    }
}
