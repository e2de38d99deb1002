package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.ProductPerformanceRow;
import com.incarts.analytics.domain.model.RetailerPerformanceRow;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.service.RetailerService;
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
 * Retailer reports, addressed by retailer name.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/retailers")
@RequiredArgsConstructor
public class RetailerController {

    private final RetailerService retailerService;

    @GetMapping("/tables/performance")
    public ResponseEntity<PaginatedResponse<RetailerPerformanceRow>> performance(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Retailers performance: page={}, size={}", page, size);
        return ResponseEntity.ok(retailerService.performance(paged(startDate, endDate, page, size)));
    }

    @GetMapping("/{retailer_name}/kpis/clicks")
    public ResponseEntity<KpiResponse> clicks(
            @PathVariable("retailer_name") String retailerName,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Retailer clicks: retailer={}, startDate={}, endDate={}", retailerName, startDate, endDate);
        return ResponseEntity.ok(retailerService.clicks(retailerName, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{retailer_name}/kpis/atc_clicks")
    public ResponseEntity<KpiResponse> atcClicks(
            @PathVariable("retailer_name") String retailerName,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Retailer ATC clicks: retailer={}, startDate={}, endDate={}", retailerName, startDate, endDate);
        return ResponseEntity.ok(retailerService.atcClicks(retailerName, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{retailer_name}/charts/click_trends")
    public ResponseEntity<TrendResponse> clickTrends(
            @PathVariable("retailer_name") String retailerName,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Retailer click trends: retailer={}, startDate={}, endDate={}", retailerName, startDate, endDate);
        return ResponseEntity.ok(retailerService.clickTrends(retailerName, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{retailer_name}/tables/product_performance")
    public ResponseEntity<PaginatedResponse<ProductPerformanceRow>> productPerformance(
            @PathVariable("retailer_name") String retailerName,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Retailer product performance: retailer={}, page={}, size={}", retailerName, page, size);
        return ResponseEntity.ok(retailerService.productPerformance(retailerName, paged(startDate, endDate, page, size)));
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
