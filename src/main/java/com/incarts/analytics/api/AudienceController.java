package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.AudienceBrowserResponse;
import com.incarts.analytics.domain.model.AudienceDeviceResponse;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.GeoHotspotsResponse;
import com.incarts.analytics.domain.service.AudienceService;
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
 * Audience breakdowns of link clicks.
 *
 * Endpoints:
 * - GET /api/v1/audience/geo/country
 * - GET /api/v1/audience/geo/state?country_name=xxx
 * - GET /api/v1/audience/device
 * - GET /api/v1/audience/browser
 * - GET /api/v1/audience/time_of_day - Categories "00:00" to "23:00"
 * - GET /api/v1/audience/day_of_week - Categories "Sunday" to "Saturday"
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/audience")
@RequiredArgsConstructor
public class AudienceController {

    private final AudienceService audienceService;

    @GetMapping("/geo/country")
    public ResponseEntity<GeoHotspotsResponse> byCountry(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Audience by country: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(audienceService.byCountry(range(startDate, endDate)));
    }

    @GetMapping("/geo/state")
    public ResponseEntity<GeoHotspotsResponse> byState(
            @RequestParam(name = "country_name", required = false) String countryName,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Audience by state: country={}, startDate={}, endDate={}", countryName, startDate, endDate);
        return ResponseEntity.ok(audienceService.byState(countryName, range(startDate, endDate)));
    }

    @GetMapping("/device")
    public ResponseEntity<AudienceDeviceResponse> devices(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Audience by device: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(audienceService.devices(range(startDate, endDate)));
    }

    @GetMapping("/browser")
    public ResponseEntity<AudienceBrowserResponse> browsers(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Audience by browser: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(audienceService.browsers(range(startDate, endDate)));
    }

    @GetMapping("/time_of_day")
    public ResponseEntity<BreakdownResponse> timeOfDay(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Audience by time of day: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(audienceService.timeOfDay(range(startDate, endDate)));
    }

    @GetMapping("/day_of_week")
    public ResponseEntity<BreakdownResponse> dayOfWeek(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Audience by day of week: startDate={}, endDate={}", startDate, endDate);
        return ResponseEntity.ok(audienceService.dayOfWeek(range(startDate, endDate)));
    }

    private AnalyticsQueryRequest range(LocalDate startDate, LocalDate endDate) {

        return AnalyticsQueryRequest.builder()
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }
}
