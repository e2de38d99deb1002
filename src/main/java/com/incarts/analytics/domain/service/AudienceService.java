package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.AudienceBrowserItem;
import com.incarts.analytics.domain.model.AudienceBrowserResponse;
import com.incarts.analytics.domain.model.AudienceDeviceItem;
import com.incarts.analytics.domain.model.AudienceDeviceResponse;
import com.incarts.analytics.domain.model.BreakdownItem;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.GeoHotspotsResponse;
import com.incarts.analytics.domain.plan.QueryTemplate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.incarts.analytics.domain.catalog.AnalyticsTemplates.CATEGORY;
import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;

/**
 * Who clicked: location, device, browser and when.
 */
@Service
@RequiredArgsConstructor
public class AudienceService {

    // Indexed by PostgreSQL's DOW (0 = Sunday)
    static final List<String> DAY_NAMES =
            List.of("Sunday", "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday");

    private final AnalyticsQueryService queryService;

    public GeoHotspotsResponse byCountry(AnalyticsQueryRequest request) {
        return GeoHotspotsResponse.builder()
                .data(OverviewService.geoItems(queryService,
                        request.filters().groupBy(LOCATION, "country_name").build()))
                .build();
    }

    public GeoHotspotsResponse byState(String countryName, AnalyticsQueryRequest request) {
        return GeoHotspotsResponse.builder()
                .data(OverviewService.geoItems(queryService, request.filters()
                        .equalTo(LOCATION, "country_name", countryName)
                        .groupBy(LOCATION, "state_name")
                        .build()))
                .build();
    }

    public AudienceDeviceResponse devices(AnalyticsQueryRequest request) {
        List<AudienceDeviceItem> items = records(AnalyticsTemplates.DEVICE_BREAKDOWN, request).stream()
                .map(row -> AudienceDeviceItem.builder()
                        .deviceType(ReportRows.string(row, CATEGORY))
                        .value(ReportRows.longValue(row, "total_clicks"))
                        .build())
                .collect(Collectors.toList());
        return AudienceDeviceResponse.builder().data(items).build();
    }

    public AudienceBrowserResponse browsers(AnalyticsQueryRequest request) {
        List<AudienceBrowserItem> items = records(AnalyticsTemplates.BROWSER_BREAKDOWN, request).stream()
                .map(row -> AudienceBrowserItem.builder()
                        .browser(ReportRows.string(row, CATEGORY))
                        .value(ReportRows.longValue(row, "total_clicks"))
                        .build())
                .collect(Collectors.toList());
        return AudienceBrowserResponse.builder().data(items).build();
    }

    /**
     * Clicks per hour of day, labelled {@code HH:00}.
     */
    public BreakdownResponse timeOfDay(AnalyticsQueryRequest request) {
        List<BreakdownItem> items = records(AnalyticsTemplates.TIME_OF_DAY, request).stream()
                .map(row -> BreakdownItem.builder()
                        .category(String.format("%02d:00", ReportRows.longValue(row, CATEGORY)))
                        .value(ReportRows.longValue(row, "total_clicks"))
                        .build())
                .collect(Collectors.toList());
        return BreakdownResponse.builder().data(items).build();
    }

    /**
     * Clicks per weekday, Sunday first.
     */
    public BreakdownResponse dayOfWeek(AnalyticsQueryRequest request) {
        List<BreakdownItem> items = records(AnalyticsTemplates.DAY_OF_WEEK, request).stream()
                .map(row -> BreakdownItem.builder()
                        .category(dayName(ReportRows.longValue(row, CATEGORY)))
                        .value(ReportRows.longValue(row, "total_clicks"))
                        .build())
                .collect(Collectors.toList());
        return BreakdownResponse.builder().data(items).build();
    }

    static String dayName(long dow) {
        if (dow < 0 || dow >= DAY_NAMES.size()) {
            return String.valueOf(dow);
        }
        return DAY_NAMES.get((int) dow);
    }

    private List<Map<String, Object>> records(QueryTemplate template, AnalyticsQueryRequest request) {
        return queryService.rows(template, request.filters().build()).getRecords();
    }
}
