package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PageAnalyticsRow;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.service.PageService;
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

@Slf4j
@RestController
@RequestMapping("/api/v1/pages")
@RequiredArgsConstructor
public class PageController {

    private final PageService pageService;

    @GetMapping("/{page_natural_key}/kpis/visits")
    public ResponseEntity<KpiResponse> visits(
            @PathVariable("page_natural_key") String pageKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Page visits: page={}, startDate={}, endDate={}", pageKey, startDate, endDate);
        return ResponseEntity.ok(pageService.visits(pageKey, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{page_natural_key}/kpis/clicks")
    public ResponseEntity<KpiResponse> clicks(
            @PathVariable("page_natural_key") String pageKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Page clicks: page={}, startDate={}, endDate={}", pageKey, startDate, endDate);
        return ResponseEntity.ok(pageService.clicks(pageKey, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{page_natural_key}/kpis/ctr")
    public ResponseEntity<KpiResponse> ctr(
            @PathVariable("page_natural_key") String pageKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Page CTR: page={}, startDate={}, endDate={}", pageKey, startDate, endDate);
        return ResponseEntity.ok(pageService.ctr(pageKey, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{page_natural_key}/charts/visit_trends")
    public ResponseEntity<TrendResponse> visitTrends(
            @PathVariable("page_natural_key") String pageKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Page visit trends: page={}, startDate={}, endDate={}", pageKey, startDate, endDate);
        return ResponseEntity.ok(pageService.visitTrends(pageKey, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{page_natural_key}/charts/click_trends")
    public ResponseEntity<TrendResponse> clickTrends(
            @PathVariable("page_natural_key") String pageKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Page click trends: page={}, startDate={}, endDate={}", pageKey, startDate, endDate);
        return ResponseEntity.ok(pageService.clickTrends(pageKey, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/tables/performance")
    public ResponseEntity<PaginatedResponse<PageAnalyticsRow>> performance(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Pages performance: page={}, size={}", page, size);
        return ResponseEntity.ok(pageService.performance(paged(startDate, endDate, page, size)));
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
