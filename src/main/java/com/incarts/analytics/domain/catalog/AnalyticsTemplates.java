package com.incarts.analytics.domain.catalog;

import com.incarts.analytics.domain.filter.ColumnSelector;
import com.incarts.analytics.domain.filter.FlagFilter;
import com.incarts.analytics.domain.plan.BranchTemplate;
import com.incarts.analytics.domain.plan.Measure;
import com.incarts.analytics.domain.plan.OrderBy;
import com.incarts.analytics.domain.plan.Projection;
import com.incarts.analytics.domain.plan.QueryTemplate;
import com.incarts.analytics.domain.plan.ResultShape;
import com.incarts.analytics.domain.schema.WarehouseSchema;

import static com.incarts.analytics.domain.schema.WarehouseSchema.CAMPAIGN;
import static com.incarts.analytics.domain.schema.WarehouseSchema.DATE;
import static com.incarts.analytics.domain.schema.WarehouseSchema.DEVICE;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LINK_CLICKS;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;
import static com.incarts.analytics.domain.schema.WarehouseSchema.PAGE;
import static com.incarts.analytics.domain.schema.WarehouseSchema.PAGE_VISITS;
import static com.incarts.analytics.domain.schema.WarehouseSchema.PRODUCT;
import static com.incarts.analytics.domain.schema.WarehouseSchema.RETAILER;

/**
 * Every query the API serves.
 *
 * Filters that narrow a report (campaign, link, page, product, retailer, link type,
 * country) are not part of the templates; requests add them through their FilterSet.
 */
public final class AnalyticsTemplates {

    public static final String ATC_FLAG = "is_atc_click";

    public static final String TOTAL_ITEMS = "total_items";
    public static final String TREND_DATE = "trend_date";
    public static final String SERIES_KEY = "series_key";
    public static final String CATEGORY = "category";
    public static final String GEO_NAME = "geo_name";

    public static final ColumnSelector CAMPAIGN_KEY = new ColumnSelector(CAMPAIGN, "campaign_natural_key");

    // KPIs

    public static final QueryTemplate TOTAL_CLICKS = QueryTemplate.builder()
            .name("total_clicks")
            .primary(clicks().measure(Measure.count("total_clicks")).build())
            .build();

    public static final QueryTemplate TOTAL_ATC_CLICKS = QueryTemplate.builder()
            .name("total_atc_clicks")
            .primary(clicks()
                    .fixedFlag(new FlagFilter(ATC_FLAG, true))
                    .measure(Measure.count("total_atc_clicks"))
                    .build())
            .build();

    public static final QueryTemplate TOTAL_LINK_VALUE = QueryTemplate.builder()
            .name("total_link_value")
            .primary(clicks().measure(Measure.sum("total_link_value", "click_value")).build())
            .build();

    public static final QueryTemplate TOTAL_PAGE_VISITS = QueryTemplate.builder()
            .name("total_page_visits")
            .primary(visits().measure(Measure.count("total_page_visits")).build())
            .build();

    public static final QueryTemplate PAGE_CTR = QueryTemplate.builder()
            .name("page_ctr")
            .primary(clicks().measure(Measure.count("total_clicks")).build())
            .denominator(visits().measure(Measure.count("total_page_visits")).build())
            .ratioAlias("page_ctr")
            .build();

    public static final QueryTemplate CONVERSION_RATE = QueryTemplate.builder()
            .name("conversion_rate")
            .primary(clicks()
                    .fixedFlag(new FlagFilter(ATC_FLAG, true))
                    .measure(Measure.count("total_atc_clicks"))
                    .build())
            .denominator(clicks().measure(Measure.count("total_clicks")).build())
            .ratioAlias("conversion_rate")
            .build();

    // Charts

    public static final QueryTemplate CLICK_TRENDS = clickTrends("click_trends", false);

    public static final QueryTemplate OVERVIEW_CLICK_TRENDS = clickTrends("overview_click_trends", true);

    public static final QueryTemplate VISIT_TRENDS = QueryTemplate.builder()
            .name("visit_trends")
            .shape(ResultShape.ROWS)
            .primary(visits().measure(Measure.count("total_visits")).build())
            .fixedGroup(Projection.of(DATE, "fulldate", TREND_DATE))
            .orderBy(OrderBy.asc(TREND_DATE))
            .build();

    public static final QueryTemplate LINK_TYPE_PERFORMANCE = breakdown("link_type_performance",
            Projection.of(LINK, "link_type_name", CATEGORY), false);

    public static final QueryTemplate GEO_HOTSPOTS = QueryTemplate.builder()
            .name("geo_hotspots")
            .shape(ResultShape.ROWS)
            .primary(clicks().measure(Measure.count("total_clicks")).build())
            .selectableGroup(new ColumnSelector(LOCATION, "country_name"))
            .selectableGroup(new ColumnSelector(LOCATION, "state_name"))
            .selectorAlias(GEO_NAME)
            .selectorRequired(true)
            .excludeNullGroups(true)
            .orderBy(OrderBy.desc("total_clicks"))
            .orderBy(OrderBy.asc(GEO_NAME))
            .build();

    public static final QueryTemplate UTM_PERFORMANCE = QueryTemplate.builder()
            .name("utm_performance")
            .shape(ResultShape.ROWS)
            .primary(clicks().measure(Measure.count("total_clicks")).build())
            .requiredFilter(CAMPAIGN_KEY)
            .selectableGroup(new ColumnSelector(LINK_CLICKS, "utm_source"))
            .selectableGroup(new ColumnSelector(LINK_CLICKS, "utm_medium"))
            .selectableGroup(new ColumnSelector(LINK_CLICKS, "utm_content"))
            .selectableGroup(new ColumnSelector(LINK_CLICKS, "utm_term"))
            .selectableGroup(new ColumnSelector(LINK_CLICKS, "utm_campaign"))
            .selectorAlias(CATEGORY)
            .selectorRequired(true)
            .excludeNullGroups(true)
            .orderBy(OrderBy.desc("total_clicks"))
            .orderBy(OrderBy.asc(CATEGORY))
            .build();

    public static final QueryTemplate DEVICE_BREAKDOWN = breakdown("device_breakdown",
            Projection.of(DEVICE, "device_type", CATEGORY), true);

    public static final QueryTemplate BROWSER_BREAKDOWN = breakdown("browser_breakdown",
            Projection.of(DEVICE, "browser", CATEGORY), true);

    public static final QueryTemplate TIME_OF_DAY = QueryTemplate.builder()
            .name("time_of_day")
            .shape(ResultShape.ROWS)
            .primary(clicks().measure(Measure.count("total_clicks")).build())
            .fixedGroup(Projection.of(DATE, "hour_of_day", CATEGORY))
            .excludeNullGroups(true)
            .orderBy(OrderBy.asc(CATEGORY))
            .build();

    public static final QueryTemplate DAY_OF_WEEK = QueryTemplate.builder()
            .name("day_of_week")
            .shape(ResultShape.ROWS)
            .primary(clicks().measure(Measure.count("total_clicks")).build())
            .fixedGroup(Projection.of(DATE, "day_of_week", CATEGORY))
            .excludeNullGroups(true)
            .orderBy(OrderBy.asc(CATEGORY))
            .build();

    // Tables

    public static final QueryTemplate LINK_PERFORMANCE = QueryTemplate.builder()
            .name("link_performance")
            .shape(ResultShape.ROWS)
            .primary(clicks()
                    .measure(Measure.count("total_clicks"))
                    .measure(Measure.countIf("atc_clicks", ATC_FLAG))
                    .measure(Measure.sum("total_link_value", "click_value"))
                    .measure(Measure.rate("conversion_rate", "atc_clicks", "total_clicks"))
                    .build())
            .fixedGroup(Projection.of(LINK, "linkkey", "link_key"))
            .fixedGroup(Projection.of(LINK, "link_name", "link_name"))
            .fixedGroup(Projection.of(LINK, "short_link_url", "short_link_url"))
            .fixedGroup(Projection.of(LINK, "link_type_name", "link_type"))
            .orderBy(OrderBy.desc("total_clicks"))
            .orderBy(OrderBy.asc("link_key"))
            .build();

    public static final QueryTemplate LINK_PERFORMANCE_COUNT = QueryTemplate.builder()
            .name("link_performance_count")
            .primary(clicks().measure(Measure.countDistinct(TOTAL_ITEMS, "linkkey")).build())
            .build();

    public static final QueryTemplate PAGE_VISIT_PERFORMANCE = QueryTemplate.builder()
            .name("page_visit_performance")
            .shape(ResultShape.ROWS)
            .primary(visits()
                    .measure(Measure.count("visits"))
                    .measure(Measure.avg("avg_time_on_page", "time_on_page"))
                    .build())
            .fixedGroup(Projection.of(PAGE, "pagekey", "page_key"))
            .fixedGroup(Projection.of(PAGE, "page_url", "page_url"))
            .fixedGroup(Projection.of(PAGE, "page_title", "page_title"))
            .orderBy(OrderBy.desc("visits"))
            .orderBy(OrderBy.asc("page_key"))
            .build();

    public static final QueryTemplate PAGE_CATALOG = QueryTemplate.builder()
            .name("page_catalog")
            .shape(ResultShape.ROWS)
            .primary(BranchTemplate.builder().fact(WarehouseSchema.PAGE_CATALOG).build())
            .selection(Projection.of(WarehouseSchema.PAGE_CATALOG, "pagekey", "page_key"))
            .selection(Projection.of(WarehouseSchema.PAGE_CATALOG, "page_url", "page_url"))
            .selection(Projection.of(WarehouseSchema.PAGE_CATALOG, "page_title", "page_title"))
            .orderBy(OrderBy.asc("page_key"))
            .build();

    public static final QueryTemplate PAGE_CLICK_TOTALS = QueryTemplate.builder()
            .name("page_click_totals")
            .shape(ResultShape.ROWS)
            .primary(clicks().measure(Measure.count("clicks")).build())
            .fixedGroup(Projection.of(PAGE, "pagekey", "page_key"))
            .orderBy(OrderBy.asc("page_key"))
            .build();

    public static final QueryTemplate PRODUCT_PERFORMANCE = QueryTemplate.builder()
            .name("product_performance")
            .shape(ResultShape.ROWS)
            .primary(clicks()
                    .measure(Measure.count("clicks"))
                    .measure(Measure.countIf("atc_clicks", ATC_FLAG))
                    .measure(Measure.rate("conversion_rate", "atc_clicks", "clicks"))
                    .measure(Measure.sum("estimated_value", "click_value"))
                    .build())
            .fixedGroup(Projection.of(PRODUCT, "productkey", "product_key"))
            .fixedGroup(Projection.of(PRODUCT, "product_name", "product_name"))
            .fixedGroup(Projection.of(PRODUCT, "product_id", "product_id"))
            .orderBy(OrderBy.desc("clicks"))
            .orderBy(OrderBy.asc("product_key"))
            .build();

    public static final QueryTemplate PRODUCT_PERFORMANCE_COUNT = QueryTemplate.builder()
            .name("product_performance_count")
            .primary(clicks().measure(Measure.countDistinct(TOTAL_ITEMS, "productkey")).build())
            .build();

    public static final QueryTemplate RETAILER_PERFORMANCE = QueryTemplate.builder()
            .name("retailer_performance")
            .shape(ResultShape.ROWS)
            .primary(clicks()
                    .measure(Measure.count("clicks"))
                    .measure(Measure.countIf("atc_clicks", ATC_FLAG))
                    .measure(Measure.rate("conversion_rate", "atc_clicks", "clicks"))
                    .measure(Measure.sum("estimated_value", "click_value"))
                    .build())
            .fixedGroup(Projection.of(RETAILER, "retailerkey", "retailer_key"))
            .fixedGroup(Projection.of(RETAILER, "retailer_name", "retailer_name"))
            .orderBy(OrderBy.desc("clicks"))
            .orderBy(OrderBy.asc("retailer_key"))
            .build();

    public static final QueryTemplate RETAILER_PERFORMANCE_COUNT = QueryTemplate.builder()
            .name("retailer_performance_count")
            .primary(clicks().measure(Measure.countDistinct(TOTAL_ITEMS, "retailerkey")).build())
            .build();

    public static final QueryTemplate CLICK_LOG = QueryTemplate.builder()
            .name("click_log")
            .shape(ResultShape.ROWS)
            .primary(clicks().build())
            .requiredFilter(CAMPAIGN_KEY)
            .selection(Projection.of(LINK_CLICKS, "clickfactkey", "click_id"))
            .selection(Projection.of(LINK_CLICKS, "click_timestamp", "click_timestamp"))
            .selection(Projection.of(LINK_CLICKS, "utm_source", "utm_source"))
            .selection(Projection.of(LINK_CLICKS, "utm_medium", "utm_medium"))
            .selection(Projection.of(LINK_CLICKS, "utm_campaign", "utm_campaign"))
            .selection(Projection.of(LINK_CLICKS, ATC_FLAG, ATC_FLAG))
            .selection(Projection.of(LINK_CLICKS, "click_value", "click_value"))
            .orderBy(OrderBy.desc("click_timestamp"))
            .orderBy(OrderBy.desc("click_id"))
            .build();

    public static final QueryTemplate CLICK_LOG_COUNT = QueryTemplate.builder()
            .name("click_log_count")
            .primary(clicks().measure(Measure.count(TOTAL_ITEMS)).build())
            .requiredFilter(CAMPAIGN_KEY)
            .build();

    private AnalyticsTemplates() {
    }

    /**
     * Click branch that may join every dimension of the click fact.
     */
    private static BranchTemplate.BranchTemplateBuilder clicks() {
        return BranchTemplate.builder()
                .fact(LINK_CLICKS)
                .optionalJoin(CAMPAIGN)
                .optionalJoin(LINK)
                .optionalJoin(PAGE)
                .optionalJoin(PRODUCT)
                .optionalJoin(RETAILER)
                .optionalJoin(LOCATION)
                .optionalJoin(DEVICE);
    }

    private static BranchTemplate.BranchTemplateBuilder visits() {
        return BranchTemplate.builder()
                .fact(PAGE_VISITS)
                .optionalJoin(CAMPAIGN)
                .optionalJoin(PAGE);
    }

    private static QueryTemplate clickTrends(String name, boolean dateRangeRequired) {
        return QueryTemplate.builder()
                .name(name)
                .shape(ResultShape.ROWS)
                .primary(clicks().measure(Measure.count("total_clicks")).build())
                .dateRangeRequired(dateRangeRequired)
                .fixedGroup(Projection.of(DATE, "fulldate", TREND_DATE))
                .selectableGroup(new ColumnSelector(LINK, "link_type_name"))
                .selectorAlias(SERIES_KEY)
                .orderBy(OrderBy.asc(SERIES_KEY))
                .orderBy(OrderBy.asc(TREND_DATE))
                .build();
    }

    private static QueryTemplate breakdown(String name, Projection group, boolean excludeNulls) {
        return QueryTemplate.builder()
                .name(name)
                .shape(ResultShape.ROWS)
                .primary(clicks().measure(Measure.count("total_clicks")).build())
                .fixedGroup(group)
                .excludeNullGroups(excludeNulls)
                .orderBy(OrderBy.desc("total_clicks"))
                .orderBy(OrderBy.asc(CATEGORY))
                .build();
    }
}
