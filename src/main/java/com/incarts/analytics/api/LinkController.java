package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.LinkPerformanceRow;
import com.incarts.analytics.domain.model.MultiTrendResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.service.LinkService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Link reports. KPIs and the performance table accept an optional link_type.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/links")
@RequiredArgsConstructor
public class LinkController {

    private final LinkService linkService;

    @GetMapping("/kpis/total_clicks")
    public ResponseEntity<KpiResponse> totalClicks(
            @RequestParam(name = "link_type", required = false) String linkType,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Links total clicks: linkType={}, startDate={}, endDate={}", linkType, startDate, endDate);
        return ResponseEntity.ok(linkService.totalClicks(linkType, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/kpis/total_atc_clicks")
    public ResponseEntity<KpiResponse> totalAtcClicks(
            @RequestParam(name = "link_type", required = false) String linkType,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Links total ATC clicks: linkType={}, startDate={}, endDate={}", linkType, startDate, endDate);
        return ResponseEntity.ok(linkService.totalAtcClicks(linkType, paged(startDate, endDate, null, null)));
    }

    /**
     * ATC clicks per 100 clicks.
     */
    @GetMapping("/kpis/conversion_rate")
    public ResponseEntity<KpiResponse> conversionRate(
            @RequestParam(name = "link_type", required = false) String linkType,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Links conversion rate: linkType={}, startDate={}, endDate={}", linkType, startDate, endDate);
        return ResponseEntity.ok(linkService.conversionRate(linkType, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/charts/click_trends")
    public ResponseEntity<MultiTrendResponse> clickTrends(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(name = "breakdown_by_link_type", defaultValue = "false") boolean breakdownByLinkType) {

        log.info("Links click trends: startDate={}, endDate={}, breakdown={}", startDate, endDate, breakdownByLinkType);
        return ResponseEntity.ok(linkService.clickTrends(paged(startDate, endDate, null, null), breakdownByLinkType));
    }

    @GetMapping("/tables/performance")
    public ResponseEntity<PaginatedResponse<LinkPerformanceRow>> performance(
            @RequestParam(name = "link_type", required = false) String linkType,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Links performance: linkType={}, page={}, size={}", linkType, page, size);
        return ResponseEntity.ok(linkService.performance(linkType, paged(startDate, endDate, page, size)));
    }

    @GetMapping("/{link_natural_key}/kpis/clicks")
    public ResponseEntity<KpiResponse> linkClicks(
            @PathVariable("link_natural_key") String linkKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Link clicks: link={}, startDate={}, endDate={}", linkKey, startDate, endDate);
        return ResponseEntity.ok(linkService.linkClicks(linkKey, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{link_natural_key}/charts/click_trends")
    public ResponseEntity<TrendResponse> linkClickTrends(
            @PathVariable("link_natural_key") String linkKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Link click trends: link={}, startDate={}, endDate={}", linkKey, startDate, endDate);
        return ResponseEntity.ok(linkService.linkClickTrends(linkKey, paged(startDate, endDate, null, null)));
    }

    private AnalyticsQueryRequest paged(LocalDate startDate, LocalDate endDate, Integer page, Integer size) {
        return AnalyticsQueryRequest.builder()
                .startDate(startDate)
                .endDate(endDate)
                .page(page)
                .size(size)
                .build();
    }
}
