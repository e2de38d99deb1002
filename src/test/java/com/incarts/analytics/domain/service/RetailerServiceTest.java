package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.executor.ExecutorRouter;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.ProductPerformanceRow;
import com.incarts.analytics.domain.model.RetailerPerformanceRow;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.result.ResultNormalizer;
import com.incarts.analytics.infrastructure.cache.QueryCacheService;
import com.incarts.analytics.infrastructure.direct.DirectQueryExecutor;
import com.incarts.analytics.infrastructure.direct.JdbcSqlBackend;
import com.incarts.analytics.infrastructure.direct.SqlStatementRenderer;
import com.incarts.analytics.testsupport.WarehouseFixture;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RetailerServiceTest {

    private static RetailerService retailerService;

    @BeforeAll
    static void setUp() {
        JdbcTemplate jdbcTemplate = WarehouseFixture.newDatabase();
        WarehouseFixture.standard().loadInto(jdbcTemplate);
        JdbcSqlBackend backend = new JdbcSqlBackend(jdbcTemplate);
        DirectQueryExecutor direct = new DirectQueryExecutor(() -> backend,
                new SqlStatementRenderer(), new ResultNormalizer());
        AnalyticsQueryService queryService = new AnalyticsQueryService(new QueryPlanBuilder(),
                new ExecutorRouter(List.of(direct)), mock(QueryCacheService.class), new SimpleMeterRegistry());
        retailerService = new RetailerService(queryService);
    }

    @Test
    void testPerformance_RankedByClicks() {
        // When
        PaginatedResponse<RetailerPerformanceRow> response = retailerService.performance(new AnalyticsQueryRequest());

        // Then
        assertEquals(2, response.getTotalItems());
        RetailerPerformanceRow acme = response.getItems().get(0);
        assertEquals("Acme", acme.getRetailerName());
        assertEquals(6, acme.getClicks());
        assertEquals(3, acme.getAtcClicks());
        assertEquals(50.0, acme.getConversionRate(), 0.0001);
        assertEquals(8.75, acme.getEstimatedValue(), 0.0001);

        RetailerPerformanceRow globex = response.getItems().get(1);
        assertEquals("Globex", globex.getRetailerName());
        assertEquals(4, globex.getClicks());
        assertEquals(0.0, globex.getConversionRate(), 0.0001);
    }

    @Test
    void testKpis_ByRetailerName() {
        // When & Then
        assertEquals(6, retailerService.clicks("Acme", new AnalyticsQueryRequest()).getValue().intValue());
        assertEquals(3, retailerService.atcClicks("Acme", new AnalyticsQueryRequest()).getValue().intValue());
        assertEquals(0, retailerService.clicks("Initech", new AnalyticsQueryRequest()).getValue().intValue());
    }

    @Test
    void testProductPerformance_ScopedToRetailer() {
        // When
        PaginatedResponse<ProductPerformanceRow> response =
                retailerService.productPerformance("Acme", new AnalyticsQueryRequest());

        // Then
        assertEquals(2, response.getTotalItems());
        ProductPerformanceRow first = response.getItems().get(0);
        assertEquals("SKU-1", first.getProductId());
        assertEquals("Cold Brew", first.getProductName());
        assertEquals(5, first.getClicks());
        assertEquals(2, first.getAtcClicks());
        assertEquals(7.5, first.getEstimatedValue(), 0.0001);
        ProductPerformanceRow second = response.getItems().get(1);
        assertEquals("SKU-2", second.getProductId());
        assertEquals(1, second.getClicks());
        assertEquals(100.0, second.getConversionRate(), 0.0001);
    }
}
