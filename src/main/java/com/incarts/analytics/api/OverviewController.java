package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.GeoHotspotsResponse;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.MultiTrendResponse;
import com.incarts.analytics.domain.service.OverviewService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Account-wide dashboard.
 *
 * Endpoints:
 * - GET /api/v1/overview/kpis/{total_clicks|total_atc_clicks|total_link_value|total_page_visits|page_ctr}
 * - GET /api/v1/overview/charts/click_trends - Daily clicks, optionally one series per link type
 * - GET /api/v1/overview/charts/link_type_performance - Clicks per link type
 * - GET /api/v1/overview/charts/geo_hotspots - Clicks per country or state
 *
 * Every endpoint accepts optional start_date / end_date (ISO 8601 dates).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/overview")
@RequiredArgsConstructor
public class OverviewController {

    private final OverviewService overviewService;

    @GetMapping("/kpis/total_clicks")
    public ResponseEntity<KpiResponse> totalClicks(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Overview total clicks: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(overviewService.totalClicks(range(startDate, endDate)));
    }

    @GetMapping("/kpis/total_atc_clicks")
    public ResponseEntity<KpiResponse> totalAtcClicks(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Overview total ATC clicks: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(overviewService.totalAtcClicks(range(startDate, endDate)));
    }

    @GetMapping("/kpis/total_link_value")
    public ResponseEntity<KpiResponse> totalLinkValue(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Overview total link value: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(overviewService.totalLinkValue(range(startDate, endDate)));
    }

    @GetMapping("/kpis/total_page_visits")
    public ResponseEntity<KpiResponse> totalPageVisits(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Overview total page visits: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(overviewService.totalPageVisits(range(startDate, endDate)));
    }

    /**
     * Link clicks per 100 page visits.
     */
    @GetMapping("/kpis/page_ctr")
    public ResponseEntity<KpiResponse> pageCtr(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Overview page CTR: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(overviewService.pageCtr(range(startDate, endDate)));
    }

    /**
     * Daily clicks. Requires at least one of start_date / end_date.
     *
     * GET /api/v1/overview/charts/click_trends?start_date=2024-01-01&end_date=2024-01-31&breakdown_by_link_type=true
     */
    @GetMapping("/charts/click_trends")
    public ResponseEntity<MultiTrendResponse> clickTrends(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "breakdown_by_link_type", defaultValue = "false") boolean breakdownByLinkType) {

        log.info("Overview click trends: startDate={}, endDate={}, breakdown={}", startDate, endDate, breakdownByLinkType);
        return ResponseEntity.ok(overviewService.clickTrends(range(startDate, endDate), breakdownByLinkType));
    }

    @GetMapping("/charts/link_type_performance")
    public ResponseEntity<BreakdownResponse> linkTypePerformance(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Overview link type performance: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(overviewService.linkTypePerformance(range(startDate, endDate)));
    }

    /**
     * GET /api/v1/overview/charts/geo_hotspots?geo_level=country|state
     */
    @GetMapping("/charts/geo_hotspots")
    public ResponseEntity<GeoHotspotsResponse> geoHotspots(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "geo_level", defaultValue = "country") String geoLevel) {

        log.info("Overview geo hotspots: startDate={}, endDate={}, geoLevel={}", startDate, endDate, geoLevel);
        return ResponseEntity.ok(overviewService.geoHotspots(range(startDate, endDate), geoLevel));
    }

    private AnalyticsQueryRequest range(LocalDate startDate, LocalDate endDate) {
        return AnalyticsQueryRequest.builder()
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
