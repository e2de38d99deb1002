package com.incarts.analytics.infrastructure.direct;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.Pagination;
import com.incarts.analytics.domain.plan.Measure;
import com.incarts.analytics.domain.plan.PlanBranch;
import com.incarts.analytics.domain.plan.PlanKind;
import com.incarts.analytics.domain.plan.Predicate;
import com.incarts.analytics.domain.plan.PredicateOperator;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.plan.ResultShape;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static com.incarts.analytics.domain.schema.WarehouseSchema.CAMPAIGN;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK_CLICKS;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;
import static org.junit.jupiter.api.Assertions.*;

class SqlStatementRendererTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate JAN_31 = LocalDate.of(2024, 1, 31);

    private final QueryPlanBuilder planBuilder = new QueryPlanBuilder();
    private final SqlStatementRenderer renderer = new SqlStatementRenderer();

    @Test
    void testRender_ScalarWithJoinsAndDateRange() {
        // Given
        FilterSet filters = FilterSet.builder()
                .dateRange(JAN_1, JAN_31)
                .equalTo(CAMPAIGN, "campaign_natural_key", "spring-sale")
                .build();

        // When
        SqlStatement statement = renderer.render(planBuilder.build(AnalyticsTemplates.TOTAL_CLICKS, filters));

        // Then
        assertEquals("SELECT COUNT(ffc.clickfactkey) AS total_clicks"
                + " FROM factlinkclicks ffc"
                + " JOIN dimcampaign dc ON ffc.campaignkey = dc.campaignkey"
                + " JOIN dimdate dd ON ffc.datekey = dd.datekey"
                + " WHERE dc.campaign_natural_key = ? AND dd.fulldate >= ? AND dd.fulldate <= ?",
                statement.getSql());
        assertEquals(List.of("spring-sale", JAN_1, JAN_31), statement.getParameters());
    }

    @Test
    void testRender_FixedFlagAfterDateRange() {
        // When
        SqlStatement statement = renderer.render(planBuilder.build(AnalyticsTemplates.TOTAL_ATC_CLICKS,
                FilterSet.builder().dateRange(JAN_1, JAN_31).build()));

        // Then
        assertTrue(statement.getSql().endsWith(
                "WHERE dd.fulldate >= ? AND dd.fulldate <= ? AND ffc.is_atc_click = ?"));
        assertEquals(List.of(JAN_1, JAN_31, true), statement.getParameters());
    }

    @Test
    void testRender_Ratio() {
        // Given
        FilterSet filters = FilterSet.builder()
                .equalTo(CAMPAIGN, "campaign_natural_key", "spring-sale")
                .build();

        // When
        SqlStatement statement = renderer.render(planBuilder.build(AnalyticsTemplates.PAGE_CTR, filters));

        // Then
        assertEquals("WITH ratio_numerator AS (SELECT COUNT(ffc.clickfactkey) AS agg_value"
                + " FROM factlinkclicks ffc JOIN dimcampaign dc ON ffc.campaignkey = dc.campaignkey"
                + " WHERE dc.campaign_natural_key = ?),"
                + " ratio_denominator AS (SELECT COUNT(fpv.pagevisitfactkey) AS agg_value"
                + " FROM factpagevisits fpv JOIN dimcampaign dc ON fpv.campaignkey = dc.campaignkey"
                + " WHERE dc.campaign_natural_key = ?)"
                + " SELECT COALESCE(CAST((SELECT agg_value FROM ratio_numerator) AS DOUBLE PRECISION) * 100.0"
                + " / NULLIF((SELECT agg_value FROM ratio_denominator), 0), 0.0) AS page_ctr",
                statement.getSql());
        assertEquals(List.of("spring-sale", "spring-sale"), statement.getParameters());
    }

    @Test
    void testRender_GroupedWithExcludedNulls() {
        // When
        SqlStatement statement = renderer.render(planBuilder.build(AnalyticsTemplates.GEO_HOTSPOTS,
                FilterSet.builder().groupBy(LOCATION, "state_name").build()));

        // Then
        assertEquals("SELECT dloc.state_name AS geo_name, COUNT(ffc.clickfactkey) AS total_clicks"
                + " FROM factlinkclicks ffc JOIN dimlocation dloc ON ffc.locationkey = dloc.locationkey"
                + " WHERE dloc.state_name IS NOT NULL"
                + " GROUP BY dloc.state_name"
                + " ORDER BY total_clicks DESC, geo_name ASC",
                statement.getSql());
        assertTrue(statement.getParameters().isEmpty());
    }

    @Test
    void testRender_DerivedGroupColumn() {
        // When
        String sql = renderer.render(planBuilder.build(AnalyticsTemplates.TIME_OF_DAY, FilterSet.empty())).getSql();

        // Then
        assertTrue(sql.startsWith("SELECT EXTRACT(HOUR FROM dd.datetime) AS category"));
        assertTrue(sql.contains("WHERE EXTRACT(HOUR FROM dd.datetime) IS NOT NULL"));
        assertTrue(sql.contains("GROUP BY EXTRACT(HOUR FROM dd.datetime)"));
    }

    @Test
    void testRender_TableMeasures() {
        // When
        String sql = renderer.render(planBuilder.build(AnalyticsTemplates.LINK_PERFORMANCE, FilterSet.builder()
                .pagination(Pagination.ofPage(1, 20))
                .build())).getSql();

        // Then
        assertTrue(sql.contains("SUM(CASE WHEN ffc.is_atc_click = TRUE THEN 1 ELSE 0 END) AS atc_clicks"));
        assertTrue(sql.contains("SUM(ffc.click_value) AS total_link_value"));
        assertTrue(sql.contains("(CAST(SUM(CASE WHEN ffc.is_atc_click = TRUE THEN 1 ELSE 0 END) AS DOUBLE PRECISION)"
                + " * 100.0 / NULLIF(COUNT(ffc.clickfactkey), 0)) AS conversion_rate"));
        assertTrue(sql.contains("GROUP BY dl.linkkey, dl.link_name, dl.short_link_url, dl.link_type_name"));
        assertTrue(sql.endsWith("ORDER BY total_clicks DESC, link_key ASC LIMIT 20 OFFSET 0"));
    }

    @Test
    void testRender_PaginatedListing() {
        // Given
        FilterSet filters = FilterSet.builder()
                .equalTo(CAMPAIGN, "campaign_natural_key", "spring-sale")
                .pagination(Pagination.ofPage(2, 20))
                .build();

        // When
        SqlStatement statement = renderer.render(planBuilder.build(AnalyticsTemplates.CLICK_LOG, filters));

        // Then
        assertEquals("SELECT ffc.clickfactkey AS click_id, ffc.click_timestamp AS click_timestamp,"
                + " ffc.utm_source AS utm_source, ffc.utm_medium AS utm_medium, ffc.utm_campaign AS utm_campaign,"
                + " ffc.is_atc_click AS is_atc_click, ffc.click_value AS click_value"
                + " FROM factlinkclicks ffc JOIN dimcampaign dc ON ffc.campaignkey = dc.campaignkey"
                + " WHERE dc.campaign_natural_key = ?"
                + " ORDER BY click_timestamp DESC, click_id DESC LIMIT 20 OFFSET 20",
                statement.getSql());
        assertEquals(List.of("spring-sale"), statement.getParameters());
    }

    @Test
    void testRender_PositionsOutOfOrder() {
        // Given
        PlanBranch branch = new PlanBranch("primary", LINK_CLICKS, List.of(),
                List.of(Predicate.bound(LINK_CLICKS, LINK_CLICKS.column("utm_source"), PredicateOperator.EQ, 2),
                        Predicate.bound(LINK_CLICKS, LINK_CLICKS.column("utm_medium"), PredicateOperator.EQ, 1)),
                List.of(Measure.count("total_clicks")));
        QueryPlan plan = QueryPlan.builder()
                .name("broken")
                .kind(PlanKind.AGGREGATE)
                .shape(ResultShape.SCALAR)
                .branches(List.of(branch))
                .groupBy(List.of())
                .selections(List.of())
                .orderBy(List.of())
                .parameters(List.of("email", "newsletter"))
                .resultAlias("total_clicks")
                .build();

        // When / Then
        assertThrows(IllegalStateException.class, () -> renderer.render(plan));
    }
}
