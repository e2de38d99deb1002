package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.ProductPerformanceRow;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.service.ProductService;
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
@RequestMapping("/api/v1/products")
@RequiredArgsConstructor
public class ProductController {

    private final ProductService productService;

    @GetMapping("/tables/performance")
    public ResponseEntity<PaginatedResponse<ProductPerformanceRow>> performance(
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Products performance: page={}, size={}", page, size);
        return ResponseEntity.ok(productService.performance(paged(startDate, endDate, page, size)));
    }

    @GetMapping("/{product_id}/kpis/clicks")
    public ResponseEntity<KpiResponse> clicks(
            @PathVariable("product_id") String productId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Product clicks: product={}, startDate={}, endDate={}", productId, startDate, endDate);
        return ResponseEntity.ok(productService.clicks(productId, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{product_id}/kpis/atc_clicks")
    public ResponseEntity<KpiResponse> atcClicks(
            @PathVariable("product_id") String productId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Product ATC clicks: product={}, startDate={}, endDate={}", productId, startDate, endDate);
        return ResponseEntity.ok(productService.atcClicks(productId, paged(startDate, endDate, null, null)));
    }

    @GetMapping("/{product_id}/charts/click_trends")
    public ResponseEntity<TrendResponse> clickTrends(
            @PathVariable("product_id") String productId,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Product click trends: product={}, startDate={}, endDate={}", productId, startDate, endDate);
        return ResponseEntity.ok(productService.clickTrends(productId, paged(startDate, endDate, null, null)));
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
