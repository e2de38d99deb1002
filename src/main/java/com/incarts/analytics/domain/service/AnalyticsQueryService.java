package com.incarts.analytics.domain.service;

import com.incarts.analytics.domain.exception.AnalyticsQueryException;
import com.incarts.analytics.domain.executor.ExecutorRouter;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.Pagination;
import com.incarts.analytics.domain.model.AnalyticsQueryRequest;
import com.incarts.analytics.domain.model.BreakdownItem;
import com.incarts.analytics.domain.model.KpiResponse;
import com.incarts.analytics.domain.model.PaginatedResponse;
import com.incarts.analytics.domain.model.TrendDataItem;
import com.incarts.analytics.domain.model.TrendSeries;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.QueryPlanBuilder;
import com.incarts.analytics.domain.plan.QueryTemplate;
import com.incarts.analytics.domain.result.ExecutionResult;
import com.incarts.analytics.infrastructure.cache.QueryCacheService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.incarts.analytics.domain.catalog.AnalyticsTemplates.CATEGORY;
import static com.incarts.analytics.domain.catalog.AnalyticsTemplates.SERIES_KEY;
import static com.incarts.analytics.domain.catalog.AnalyticsTemplates.TREND_DATE;

/**
 * Entry point from the report services into the query core.
 *
 * Query Flow:
 * 1. Build the plan (invalid filters fail here, before cache or backend)
 * 2. Scalar plans: check the KPI cache (Redis)
 * 3. Run the plan through the executor router
 * 4. Scalar plans: cache the value unless the result is degraded
 *
 * Row results are not cached.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsQueryService {

    private static final String CACHE_PREFIX = "analytics:kpi";

    private final QueryPlanBuilder planBuilder;
    private final ExecutorRouter executorRouter;
    private final QueryCacheService cacheService;
    private final MeterRegistry meterRegistry;

    @Value("${app.cache.enabled:true}")
    private boolean cacheEnabled;

    @Value("${app.cache.ttl.kpi:300}")
    private long kpiTtl;

    public ExecutionResult.Scalar scalar(QueryTemplate template, FilterSet filters) {
        QueryPlan plan = planBuilder.build(template, filters);
        String cacheKey = cacheService.generateCacheKey(CACHE_PREFIX, template.getName(), filters.describe());

        if (cacheEnabled) {
            Optional<Number> cached = cacheService.get(cacheKey, Number.class);
            if (cached.isPresent()) {
                log.debug("Cache hit for query: {}", cacheKey);
                countCache("hit");
                return ExecutionResult.scalar(cached.get(), Collections.emptyList());
            }
            log.debug("Cache miss for query: {}", cacheKey);
            countCache("miss");
        }

        ExecutionResult.Scalar result = execute(plan).asScalar();
        if (cacheEnabled && !result.isDegraded() && result.getValue() != null) {
            cacheService.set(cacheKey, result.getValue(), kpiTtl);
        }
        return result;
    }

    public ExecutionResult.Rows rows(QueryTemplate template, FilterSet filters) {
        return execute(planBuilder.build(template, filters)).asRows();
    }

    public KpiResponse kpi(QueryTemplate template, FilterSet filters) {
        ExecutionResult.Scalar result = scalar(template, filters);
        return KpiResponse.builder()
                .value((Number) result.getValue())
                .label(template.getName())
                .degraded(result.isDegraded())
                .build();
    }

    /**
     * Single date series of a trend template.
     */
    public List<TrendDataItem> trend(QueryTemplate template, FilterSet filters, String valueAlias) {
        return rows(template, filters).getRecords().stream()
                .map(row -> toTrendItem(row, valueAlias))
                .collect(Collectors.toList());
    }

    /**
     * Trend split by the series key when the request grouped by one, otherwise a single
     * series named {@code defaultName}. Series keep the order of their first row.
     */
    public List<TrendSeries> trendSeries(QueryTemplate template, FilterSet filters, String valueAlias,
                                         String defaultName) {
        List<Map<String, Object>> records = rows(template, filters).getRecords();
        if (filters.getGroupBy().isEmpty()) {
            List<TrendDataItem> data = records.stream()
                    .map(row -> toTrendItem(row, valueAlias))
                    .collect(Collectors.toList());
            return List.of(TrendSeries.builder().name(defaultName).data(data).build());
        }

        Map<String, List<TrendDataItem>> grouped = new LinkedHashMap<>();
        for (Map<String, Object> row : records) {
            grouped.computeIfAbsent(ReportRows.string(row, SERIES_KEY), key -> new ArrayList<>())
                    .add(toTrendItem(row, valueAlias));
        }
        List<TrendSeries> series = new ArrayList<>(grouped.size());
        grouped.forEach((name, data) -> series.add(TrendSeries.builder().name(name).data(data).build()));
        return series;
    }

    public List<BreakdownItem> breakdown(QueryTemplate template, FilterSet filters, String valueAlias) {
        return rows(template, filters).getRecords().stream()
                .map(row -> BreakdownItem.builder()
                        .category(ReportRows.string(row, CATEGORY))
                        .value((Number) row.get(valueAlias))
                        .build())
                .collect(Collectors.toList());
    }

    /**
     * One page of a ranked table: the total comes from {@code countTemplate}, the page
     * from {@code rowsTemplate}. Both see the same filters.
     */
    public <T> PaginatedResponse<T> paginated(QueryTemplate countTemplate, QueryTemplate rowsTemplate,
                                              FilterSet.Builder filters, AnalyticsQueryRequest request,
                                              Function<Map<String, Object>, T> mapper) {
        Pagination pagination = request.pagination();
        ExecutionResult.Scalar total = scalar(countTemplate, filters.build());
        long totalItems = total.longValue();
        if (totalItems == 0) {
            return PaginatedResponse.of(Collections.emptyList(), 0, request.getPage(), request.getSize(),
                    total.isDegraded());
        }

        ExecutionResult.Rows rows = rows(rowsTemplate, filters.pagination(pagination).build());
        List<T> items = rows.getRecords().stream().map(mapper).collect(Collectors.toList());
        return PaginatedResponse.of(items, totalItems, request.getPage(), request.getSize(),
                total.isDegraded() || rows.isDegraded());
    }

    private TrendDataItem toTrendItem(Map<String, Object> row, String valueAlias) {
        return TrendDataItem.builder()
                .date(ReportRows.date(row, TREND_DATE))
                .value((Number) row.get(valueAlias))
                .build();
    }

    private ExecutionResult execute(QueryPlan plan) {
        Timer.Sample sample = Timer.start(meterRegistry);
        long startTime = System.currentTimeMillis();
        try {
            ExecutionResult result = executorRouter.execute(plan);

            sample.stop(Timer.builder("analytics.query.latency")
                    .tag("template", plan.getName())
                    .tag("shape", plan.getShape().name())
                    .register(meterRegistry));

            Counter.builder("analytics.query.executed")
                    .tag("template", plan.getName())
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();

            if (result.isDegraded()) {
                Counter.builder("analytics.query.degraded")
                        .tag("template", plan.getName())
                        .register(meterRegistry)
                        .increment();
            }

            log.info("Query {} executed: {} ms", plan.getName(), System.currentTimeMillis() - startTime);
            return result;

        } catch (AnalyticsQueryException e) {
            Counter.builder("analytics.query.executed")
                    .tag("template", plan.getName())
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();
            throw e;
        }
    }

    private void countCache(String outcome) {
        Counter.builder("analytics.query.cache")
                .tag("result", outcome)
                .register(meterRegistry)
                .increment();
    }
}
