package com.incarts.analytics.domain.schema;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

import static com.incarts.analytics.domain.schema.ColumnUsage.FILTER;
import static com.incarts.analytics.domain.schema.ColumnUsage.GROUP;

/**
 * The click/visit star schema.
 *
 * Facts:
 * - factlinkclicks: one row per link click, joins every dimension
 * - factpagevisits: one row per landing page visit, joins campaign, page and date
 *
 * {@link #PAGE_CATALOG} reads dimpage as a listing source so that pages without
 * traffic can still be reported.
 *
 * The date dimension's surrogate key is the {@code yyyyMMdd} integer of its full date,
 * which lets fact tables be range-filtered on their own date key.
 */
public final class WarehouseSchema {

    private static final DateTimeFormatter DATE_KEY_FORMAT = DateTimeFormatter.BASIC_ISO_DATE;

    public static final DimensionRef CAMPAIGN = DimensionRef.builder(DimensionKind.CAMPAIGN, "dimcampaign", "dc")
            .key("campaignkey")
            .naturalKey("campaign_natural_key", ColumnType.STRING)
            .column("campaign_name", ColumnType.STRING, FILTER, GROUP)
            .build();

    public static final DimensionRef LINK = DimensionRef.builder(DimensionKind.LINK, "dimlink", "dl")
            .key("linkkey")
            .naturalKey("link_natural_key", ColumnType.STRING)
            .column("link_name", ColumnType.STRING, GROUP)
            .column("short_link_url", ColumnType.STRING, GROUP)
            .column("link_type_name", ColumnType.STRING, FILTER, GROUP)
            .build();

    public static final DimensionRef PAGE = DimensionRef.builder(DimensionKind.PAGE, "dimpage", "dp")
            .key("pagekey")
            .naturalKey("page_natural_key", ColumnType.STRING)
            .column("page_url", ColumnType.STRING, GROUP)
            .column("page_title", ColumnType.STRING, GROUP)
            .build();

    public static final DimensionRef PRODUCT = DimensionRef.builder(DimensionKind.PRODUCT, "dimproduct", "dprod")
            .key("productkey")
            .naturalKey("product_id", ColumnType.STRING)
            .column("product_name", ColumnType.STRING, GROUP)
            .build();

    public static final DimensionRef RETAILER = DimensionRef.builder(DimensionKind.RETAILER, "dimretailer", "dr")
            .key("retailerkey")
            .naturalKey("retailer_name", ColumnType.STRING)
            .build();

    public static final DimensionRef LOCATION = DimensionRef.builder(DimensionKind.LOCATION, "dimlocation", "dloc")
            .key("locationkey")
            .column("country_name", ColumnType.STRING, FILTER, GROUP)
            .column("state_name", ColumnType.STRING, FILTER, GROUP)
            .build();

    public static final DimensionRef DEVICE = DimensionRef.builder(DimensionKind.DEVICE, "dimdevice", "ddev")
            .key("devicekey")
            .column("device_type", ColumnType.STRING, FILTER, GROUP)
            .column("browser", ColumnType.STRING, FILTER, GROUP)
            .build();

    public static final DimensionRef DATE = DimensionRef.builder(DimensionKind.DATE, "dimdate", "dd")
            .key("datekey")
            .column("fulldate", ColumnType.DATE, FILTER, GROUP)
            .column("datetime", ColumnType.TIMESTAMP)
            .derived("hour_of_day", ColumnType.INTEGER, "EXTRACT(HOUR FROM {alias}.datetime)", GROUP)
            .derived("day_of_week", ColumnType.INTEGER, "EXTRACT(DOW FROM {alias}.datetime)", GROUP)
            .build();

    public static final FactRef LINK_CLICKS = FactRef.builder("factlinkclicks", "ffc")
            .primaryKey("clickfactkey")
            .dateKey("datekey")
            .joins(DimensionKind.CAMPAIGN, "campaignkey")
            .joins(DimensionKind.LINK, "linkkey")
            .joins(DimensionKind.PAGE, "pagekey")
            .joins(DimensionKind.PRODUCT, "productkey")
            .joins(DimensionKind.RETAILER, "retailerkey")
            .joins(DimensionKind.LOCATION, "locationkey")
            .joins(DimensionKind.DEVICE, "devicekey")
            .column("is_atc_click", ColumnType.BOOLEAN, FILTER)
            .column("click_value", ColumnType.DECIMAL)
            .column("click_timestamp", ColumnType.TIMESTAMP, GROUP)
            .column("utm_source", ColumnType.STRING, FILTER, GROUP)
            .column("utm_medium", ColumnType.STRING, FILTER, GROUP)
            .column("utm_content", ColumnType.STRING, FILTER, GROUP)
            .column("utm_term", ColumnType.STRING, FILTER, GROUP)
            .column("utm_campaign", ColumnType.STRING, FILTER, GROUP)
            .build();

    public static final FactRef PAGE_VISITS = FactRef.builder("factpagevisits", "fpv")
            .primaryKey("pagevisitfactkey")
            .dateKey("datekey")
            .joins(DimensionKind.CAMPAIGN, "campaignkey")
            .joins(DimensionKind.PAGE, "pagekey")
            .column("time_on_page", ColumnType.DECIMAL)
            .build();

    public static final FactRef PAGE_CATALOG = FactRef.builder("dimpage", "pg")
            .primaryKey("pagekey")
            .column("page_url", ColumnType.STRING)
            .column("page_title", ColumnType.STRING)
            .build();

    private static final List<DimensionRef> DIMENSIONS =
            List.of(CAMPAIGN, LINK, PAGE, PRODUCT, RETAILER, LOCATION, DEVICE, DATE);

    private static final List<FactRef> FACTS = List.of(LINK_CLICKS, PAGE_VISITS);

    private WarehouseSchema() {
    }

    public static List<DimensionRef> dimensions() {
        return DIMENSIONS;
    }

    public static List<FactRef> facts() {
        return FACTS;
    }

    public static Optional<TableRef> table(String tableName) {
        return Stream.<TableRef>concat(FACTS.stream(), DIMENSIONS.stream())
                .filter(table -> table.getTableName().equals(tableName))
                .findFirst();
    }

    public static DimensionRef dimension(DimensionKind kind) {
        return DIMENSIONS.stream()
                .filter(dimension -> dimension.getKind() == kind)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No dimension of kind " + kind));
    }

    public static int toDateKey(LocalDate date) {
        return Integer.parseInt(date.format(DATE_KEY_FORMAT));
    }
}
