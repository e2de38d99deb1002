package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.catalog.AnalyticsTemplates;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.BreakdownItem;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.GeoHotspotsResponse;
import com.incarts.analytics.domain.result.ExecutionResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.incarts.analytics.domain.schema.WarehouseSchema.LOCATION;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AudienceServiceTest {

    @Mock
    private AnalyticsQueryService queryService;

    private AudienceService audienceService;

    @BeforeEach
    void setUp() {
        audienceService = new AudienceService(queryService);
    }

    @Test
    void testTimeOfDay_HourLabels() {
        // Given
        when(queryService.rows(eq(AnalyticsTemplates.TIME_OF_DAY), any())).thenReturn(rows(
                Map.of("category", 9L, "total_clicks", 2L),
                Map.of("category", 14L, "total_clicks", 4L)));

        // When
        BreakdownResponse response = audienceService.timeOfDay(new AnalyticsQueryRequest());

        // Then
        assertEquals(List.of("09:00", "14:00"), categories(response));
        assertEquals(4L, response.getData().get(1).getValue());
    }

    @Test
    void testDayOfWeek_SundayFirst() {
        // Given
        when(queryService.rows(eq(AnalyticsTemplates.DAY_OF_WEEK), any())).thenReturn(rows(
                Map.of("category", 0L, "total_clicks", 1L),
                Map.of("category", 3L, "total_clicks", 5L),
                Map.of("category", 6L, "total_clicks", 2L)));

        // When
        BreakdownResponse response = audienceService.dayOfWeek(new AnalyticsQueryRequest());

        // Then
        assertEquals(List.of("Sunday", "Wednesday", "Saturday"), categories(response));
    }

    @Test
    void testDayName_OutOfRange() {
        assertEquals("Monday", AudienceService.dayName(1));
        assertEquals("7", AudienceService.dayName(7));
        assertEquals("-1", AudienceService.dayName(-1));
    }

    @Test
    void testByState_FiltersCountryAndGroupsByState() {
        // Given
        when(queryService.rows(eq(AnalyticsTemplates.GEO_HOTSPOTS), any())).thenReturn(rows(
                Map.of("geo_name", "California", "total_clicks", 5L)));
        AnalyticsQueryRequest request = AnalyticsQueryRequest.builder()
                .startDate(LocalDate.of(2024, 1, 1))
                .build();

        // When
        GeoHotspotsResponse response = audienceService.byState("United States", request);

        // Then
        assertEquals(1, response.getData().size());
        ArgumentCaptor<FilterSet> filters = ArgumentCaptor.forClass(FilterSet.class);
        verify(queryService).rows(eq(AnalyticsTemplates.GEO_HOTSPOTS), filters.capture());
        assertEquals(LOCATION, filters.getValue().getGroupBy().orElseThrow().getTable());
        assertEquals("state_name", filters.getValue().getGroupBy().orElseThrow().getColumn());
        assertEquals(1, filters.getValue().getEqualityFilters().size());
        assertEquals(LocalDate.of(2024, 1, 1), filters.getValue().getDateRange().getStart());
    }

    @Test
    void testByState_AllCountries() {
        // Given
        when(queryService.rows(eq(AnalyticsTemplates.GEO_HOTSPOTS), any())).thenReturn(rows());

        // When
        audienceService.byState(null, new AnalyticsQueryRequest());

        // Then
        ArgumentCaptor<FilterSet> filters = ArgumentCaptor.forClass(FilterSet.class);
        verify(queryService).rows(eq(AnalyticsTemplates.GEO_HOTSPOTS), filters.capture());
        assertTrue(filters.getValue().getEqualityFilters().isEmpty());
    }

    @SafeVarargs
    private static ExecutionResult.Rows rows(Map<String, Object>... records) {
        return ExecutionResult.rows(List.of(records), Collections.emptyList());
    }

    private static List<String> categories(BreakdownResponse response) {
        return response.getData().stream().map(BreakdownItem::getCategory).collect(Collectors.toList());
    }
}
