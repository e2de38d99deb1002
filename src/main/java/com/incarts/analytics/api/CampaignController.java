package com.incarts.analytics.api;

import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.BreakdownResponse;
import com.incarts.analytics.domain.model.ClickLogRow;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.LinkPerformanceInCampaignRow;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendResponse;
import com.incarts.analytics.domain.service.CampaignService;
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
 * Reports for a single campaign.
 *
 * Endpoints:
 * - GET /api/v1/campaigns/{key}/kpis/{total_clicks|total_atc_clicks|total_link_value|total_page_visits|page_ctr}
 * - GET /api/v1/campaigns/{key}/charts/click_trends - Daily clicks
 * - GET /api/v1/campaigns/{key}/charts/utm_performance - Clicks per UTM value
 * - GET /api/v1/campaigns/{key}/tables/link_performance - Paginated link table
 * - GET /api/v1/campaigns/{key}/tables/click_log - Paginated raw clicks, newest first
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/campaigns/{campaign_natural_key}")
@RequiredArgsConstructor
public class CampaignController {

    private final CampaignService campaignService;

    @GetMapping("/kpis/total_clicks")
    public ResponseEntity<KpiResponse> totalClicks(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign total clicks: campaign={}, startDate={}, endDate={}", campaignKey, startDate, endDate);
        return ResponseEntity.ok(campaignService.totalClicks(campaignKey, range(startDate, endDate)));
    }

    @GetMapping("/kpis/total_atc_clicks")
    public ResponseEntity<KpiResponse> totalAtcClicks(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign total ATC clicks: campaign={}, startDate={}, endDate={}", campaignKey, startDate, endDate);
        return ResponseEntity.ok(campaignService.totalAtcClicks(campaignKey, range(startDate, endDate)));
    }

    @GetMapping("/kpis/total_link_value")
    public ResponseEntity<KpiResponse> totalLinkValue(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign total link value: campaign={}, startDate={}, endDate={}", campaignKey, startDate, endDate);
        return ResponseEntity.ok(campaignService.totalLinkValue(campaignKey, range(startDate, endDate)));
    }

    @GetMapping("/kpis/total_page_visits")
    public ResponseEntity<KpiResponse> totalPageVisits(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign total page visits: campaign={}, startDate={}, endDate={}", campaignKey, startDate, endDate);
        return ResponseEntity.ok(campaignService.totalPageVisits(campaignKey, range(startDate, endDate)));
    }

    @GetMapping("/kpis/page_ctr")
    public ResponseEntity<KpiResponse> pageCtr(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign page CTR: campaign={}, startDate={}, endDate={}", campaignKey, startDate, endDate);
        return ResponseEntity.ok(campaignService.pageCtr(campaignKey, range(startDate, endDate)));
    }

    @GetMapping("/charts/click_trends")
    public ResponseEntity<TrendResponse> clickTrends(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign click trends: campaign={}, startDate={}, endDate={}", campaignKey, startDate, endDate);
        return ResponseEntity.ok(campaignService.clickTrends(campaignKey, range(startDate, endDate)));
    }

    /**
     * GET /api/v1/campaigns/{key}/charts/utm_performance?utm_parameter=source|medium|content|term|campaign_name
     */
    @GetMapping("/charts/utm_performance")
    public ResponseEntity<BreakdownResponse> utmPerformance(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "utm_parameter") String utmParameter,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate) {

        log.info("Campaign UTM performance: campaign={}, utmParameter={}", campaignKey, utmParameter);
        return ResponseEntity.ok(campaignService.utmPerformance(campaignKey, utmParameter, range(startDate, endDate)));
    }

    @GetMapping("/tables/link_performance")
    public ResponseEntity<PaginatedResponse<LinkPerformanceInCampaignRow>> linkPerformance(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Campaign link performance: campaign={}, page={}, size={}", campaignKey, page, size);
        return ResponseEntity.ok(campaignService.linkPerformance(campaignKey, paged(startDate, endDate, page, size)));
    }

    @GetMapping("/tables/click_log")
    public ResponseEntity<PaginatedResponse<ClickLogRow>> clickLog(
            @PathVariable("campaign_natural_key") String campaignKey,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer size) {

        log.info("Campaign click log: campaign={}, page={}, size={}", campaignKey, page, size);
        return ResponseEntity.ok(campaignService.clickLog(campaignKey, paged(startDate, endDate, page, size)));
    }

    private AnalyticsQueryRequest range(LocalDate startDate, LocalDate endDate) {
        return paged(startDate, endDate, null, null);
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
