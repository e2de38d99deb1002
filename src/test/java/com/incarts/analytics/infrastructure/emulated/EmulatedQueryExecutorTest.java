package com.incarts.analytics.infrastructure.emulated;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.exception.UnsupportedPlanException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.Pagination;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.plan.QueryTemplate;
import com.incarts.analytics.domain.result.DegradedLookup;
import com.incarts.analytics.domain.result.ExecutionResult;
import com.incarts.analytics.domain.result.ResultNormalizer;
import com.incarts.analytics.testsupport.InMemoryTableBackend;
import com.incarts.analytics.testsupport.WarehouseFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static com.incarts.analytics.domain.schema.WarehouseSchema.CAMPAIGN;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class EmulatedQueryExecutorTest {

    private static final BackendCapabilities SERVER_SIDE = new BackendCapabilities(true, true);
    private static final BackendCapabilities CLIENT_SIDE = new BackendCapabilities(false, false);

    private final QueryPlanBuilder planBuilder = new QueryPlanBuilder();

    private InMemoryTableBackend tables;
    private EmulatedQueryExecutor executor;

    @BeforeEach
    void setUp() {
        tables = WarehouseFixture.standard().tableBackend(SERVER_SIDE);
        executor = executorOver(tables, 10_000, 500);
    }

    @Test
    void testExecute_TotalsWithoutFilters() {
        assertEquals(10L, scalar(AnalyticsTemplates.TOTAL_CLICKS, FilterSet.empty()));
        assertEquals(3L, scalar(AnalyticsTemplates.TOTAL_ATC_CLICKS, FilterSet.empty()));
        assertEquals(10.75, (Double) scalar(AnalyticsTemplates.TOTAL_LINK_VALUE, FilterSet.empty()), 0.0001);
        assertEquals(5L, scalar(AnalyticsTemplates.TOTAL_PAGE_VISITS, FilterSet.empty()));
    }

    @Test
    void testExecute_CampaignFilterBecomesKeyLookup() {
        // When
        Object clicks = scalar(AnalyticsTemplates.TOTAL_CLICKS, campaign("spring-sale").build());

        // Then
        assertEquals(5L, clicks);
        List<TableQuery> lookups = tables.requestsOn("dimcampaign");
        assertEquals(1, lookups.size());
        assertEquals(List.of(TableFilter.eq("campaign_natural_key", "spring-sale")), lookups.get(0).getFilters());
        assertEquals(501, lookups.get(0).getLimit());

        TableQuery count = tables.requestsOn("factlinkclicks").get(0);
        assertTrue(count.isCountOnly());
        assertEquals(List.of(TableFilter.eq("campaignkey", 1)), count.getFilters());
    }

    @Test
    void testExecute_DateRangeUsesFactDateKey() {
        // Given
        FilterSet filters = FilterSet.builder()
                .dateRange(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 5))
                .build();

        // When
        Object clicks = scalar(AnalyticsTemplates.TOTAL_CLICKS, filters);

        // Then
        assertEquals(5L, clicks);
        assertTrue(tables.requestsOn("dimdate").isEmpty());
        assertEquals(List.of(TableFilter.gte("datekey", 20240102), TableFilter.lte("datekey", 20240105)),
                tables.requestsOn("factlinkclicks").get(0).getFilters());
    }

    @Test
    void testExecute_MultipleLookupKeysBecomeMembershipFilter() {
        // When
        Object clicks = scalar(AnalyticsTemplates.TOTAL_CLICKS,
                FilterSet.builder().equalTo(LOCATION, "country_name", "United States").build());

        // Then
        assertEquals(8L, clicks);
        assertEquals(List.of(TableFilter.in("locationkey", List.of(1, 2))),
                tables.requestsOn("factlinkclicks").get(0).getFilters());
    }

    @Test
    void testExecute_UnknownCampaignShortCircuits() {
        // Given
        FilterSet unknown = campaign("no-such-campaign").build();

        // When
        Object clicks = scalar(AnalyticsTemplates.TOTAL_CLICKS, unknown);
        Object value = scalar(AnalyticsTemplates.TOTAL_LINK_VALUE, unknown);

        // Then
        assertEquals(0L, clicks);
        assertEquals(0.0, value);
        assertTrue(tables.requestsOn("factlinkclicks").isEmpty());
    }

    @Test
    void testExecute_Ratios() {
        assertEquals(125.0, (Double) scalar(AnalyticsTemplates.PAGE_CTR, campaign("spring-sale").build()), 0.0001);
        assertEquals(300.0, (Double) scalar(AnalyticsTemplates.PAGE_CTR, campaign("summer-sale").build()), 0.0001);
        assertEquals(0.0, scalar(AnalyticsTemplates.PAGE_CTR, campaign("fall-sale").build()));
        assertEquals(40.0, (Double) scalar(AnalyticsTemplates.CONVERSION_RATE, campaign("spring-sale").build()), 0.0001);
    }

    @Test
    void testExecute_GroupedPlanIsUnsupported() {
        // Given
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.LINK_PERFORMANCE, FilterSet.empty());

        // When
        UnsupportedPlanException exception = assertThrows(UnsupportedPlanException.class, () -> executor.execute(plan));

        // Then
        assertEquals(ExecutorKind.EMULATED, exception.getExecutorKind());
        assertTrue(tables.requests().isEmpty());
    }

    @Test
    void testExecute_FailedLookupDegradesResult() {
        // Given
        tables.failOn("dimcampaign");
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.TOTAL_CLICKS, campaign("spring-sale").build());

        // When
        ExecutionResult result = executor.execute(plan);

        // Then
        assertTrue(result.isDegraded());
        assertEquals(0L, result.asScalar().getValue());
        DegradedLookup degraded = result.getDegradations().get(0);
        assertEquals("dimcampaign", degraded.getTable());
        assertEquals("campaign_natural_key", degraded.getColumn());
        assertTrue(tables.requestsOn("factlinkclicks").isEmpty());
    }

    @Test
    void testExecute_UnreadableLookupResponseDegradesResult() {
        // Given
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        server.expect(requestTo("https://abcdefgh.supabase.co/rest/v1/dimcampaign"
                        + "?select=campaignkey&campaign_natural_key=eq.spring-sale&limit=501"))
                .andRespond(withSuccess("<html>gateway</html>", MediaType.TEXT_HTML));
        PostgrestTableBackend postgrest = new PostgrestTableBackend(restTemplate,
                "https://abcdefgh.supabase.co", "anon-key", 1000);
        EmulatedQueryExecutor restExecutor = new EmulatedQueryExecutor(() -> postgrest,
                new ResultNormalizer(), 10_000, 500);
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.TOTAL_CLICKS, campaign("spring-sale").build());

        // When
        ExecutionResult result = restExecutor.execute(plan);

        // Then
        assertTrue(result.isDegraded());
        assertEquals(0L, result.asScalar().getValue());
        assertEquals("dimcampaign", result.getDegradations().get(0).getTable());
        server.verify();
    }

    @Test
    void testCompareValues_MixedNumericTypes() {
        assertTrue(EmulatedQueryExecutor.compareValues(2, 10L) < 0);
        assertTrue(EmulatedQueryExecutor.compareValues(2.5, 2) > 0);
        assertEquals(0, EmulatedQueryExecutor.compareValues(3L, 3.0));
        assertTrue(EmulatedQueryExecutor.compareValues("2024-01-02T10:00:00", "2024-01-15T12:00:00") < 0);
        assertTrue(EmulatedQueryExecutor.compareValues(false, true) < 0);
    }

    @Test
    void testExecute_ListingPagedByBackend() {
        // Given
        tables = WarehouseFixture.standard().bulkCampaign(4, "bulk-sale", 25).tableBackend(SERVER_SIDE);
        executor = executorOver(tables, 10_000, 500);

        // When
        List<Map<String, Object>> rows = clickLogPage(2, 20);

        // Then
        assertBulkSecondPage(rows);
        List<TableQuery> factRequests = tables.requestsOn("factlinkclicks");
        assertEquals(1, factRequests.size());
        assertEquals(20, factRequests.get(0).getOffset());
        assertEquals(20, factRequests.get(0).getLimit());
        assertEquals(List.of(new TableOrder("click_timestamp", true), new TableOrder("clickfactkey", true)),
                factRequests.get(0).getOrdering());
    }

    @Test
    void testExecute_ListingPagedClientSide() {
        // Given
        tables = WarehouseFixture.standard().bulkCampaign(4, "bulk-sale", 25).tableBackend(CLIENT_SIDE);
        executor = executorOver(tables, 10_000, 500);

        // When
        List<Map<String, Object>> rows = clickLogPage(2, 20);

        // Then
        assertBulkSecondPage(rows);
        List<TableQuery> factRequests = tables.requestsOn("factlinkclicks");
        assertEquals(2, factRequests.size());
        assertTrue(factRequests.get(0).isCountOnly());
        assertTrue(factRequests.get(1).getOrdering().isEmpty());
    }

    @Test
    void testExecute_ClientSideListingOverRowCap() {
        // Given
        tables = WarehouseFixture.standard().bulkCampaign(4, "bulk-sale", 25).tableBackend(CLIENT_SIDE);
        executor = executorOver(tables, 10, 500);

        // When / Then
        assertThrows(UnsupportedPlanException.class, () -> clickLogPage(1, 20));
    }

    @Test
    void testExecute_FetchedAggregateOverRowCap() {
        // Given
        executor = executorOver(tables, 5, 500);
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.TOTAL_LINK_VALUE, FilterSet.empty());

        // When / Then
        assertThrows(UnsupportedPlanException.class, () -> executor.execute(plan));
    }

    @Test
    void testExecute_LookupOverKeyCap() {
        // Given
        executor = executorOver(tables, 10_000, 1);
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.TOTAL_CLICKS,
                FilterSet.builder().equalTo(LOCATION, "country_name", "United States").build());

        // When / Then
        assertThrows(UnsupportedPlanException.class, () -> executor.execute(plan));
    }

    private List<Map<String, Object>> clickLogPage(int page, int size) {
        QueryPlan plan = planBuilder.build(AnalyticsTemplates.CLICK_LOG,
                campaign("bulk-sale").pagination(Pagination.ofPage(page, size)).build());
        return executor.execute(plan).asRows().getRecords();
    }

    private static void assertBulkSecondPage(List<Map<String, Object>> rows) {
        assertEquals(5, rows.size());
        assertEquals(1004L, rows.get(0).get("click_id"));
        assertEquals(LocalDateTime.of(2024, 1, 15, 12, 4), rows.get(0).get("click_timestamp"));
        assertEquals(1000L, rows.get(4).get("click_id"));
        assertEquals(Boolean.TRUE, rows.get(4).get("is_atc_click"));
    }

    private static EmulatedQueryExecutor executorOver(InMemoryTableBackend tables, int maxRows, int maxLookupKeys) {
        return new EmulatedQueryExecutor(() -> tables, new ResultNormalizer(), maxRows, maxLookupKeys);
    }

    private static FilterSet.Builder campaign(String naturalKey) {
        return FilterSet.builder().equalTo(CAMPAIGN, "campaign_natural_key", naturalKey);
    }

    private Object scalar(QueryTemplate template, FilterSet filters) {
        return executor.execute(planBuilder.build(template, filters)).asScalar().getValue();
    }
}
