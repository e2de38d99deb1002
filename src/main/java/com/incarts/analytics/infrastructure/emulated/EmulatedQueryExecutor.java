package com.incarts.analytics.infrastructure.emulated;

import com.incarts.analytics.domain.exception.BackendQueryException;
import com.incarts.analytics.domain.exception.UnsupportedPlanException;
import com.incarts.analytics.domain.executor.ExecutorKind;
import com.incarts.analytics.domain.executor.QueryExecutor;
import com.incarts.analytics.domain.plan.Measure;
import com.incarts.analytics.domain.plan.OrderBy;
import com.incarts.analytics.domain.plan.PlanBranch;
import com.incarts.analytics.domain.plan.PlanKind;
import com.incarts.analytics.domain.plan.Predicate;
import com.incarts.analytics.domain.plan.Projection;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.ResultShape;
import com.incarts.analytics.domain.result.DegradedLookup;
import com.incarts.analytics.domain.result.ExecutionResult;
import com.incarts.analytics.domain.result.RawResult;
import com.incarts.analytics.domain.result.ResultNormalizer;
import com.incarts.analytics.domain.schema.DimensionKind;
import com.incarts.analytics.domain.schema.DimensionRef;
import com.incarts.analytics.domain.schema.FactRef;
import com.incarts.analytics.domain.schema.WarehouseSchema;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Executes plans with single-table primitives only.
 *
 * Supported shapes:
 * - ungrouped COUNT / COUNT_IF: one exact-count request on the fact
 * - ungrouped SUM / AVG / COUNT_DISTINCT / RATE: bounded fetch of the fact column, reduced here
 * - RATIO: both halves computed as above, divided here
 * - LISTING of fact columns: ordered and windowed by the backend when it can, here otherwise
 *
 * Dimension predicates become membership filters on the fact's foreign key after a
 * key lookup on the dimension. A lookup with no match short-circuits to an empty result.
 * A lookup that fails is treated as no match and recorded as a {@link DegradedLookup}.
 *
 * Grouped plans are rejected with {@link UnsupportedPlanException}, as are plans whose
 * key lookups exceed {@code maxLookupKeys} or whose client-side work exceeds
 * {@code maxRows} fact rows.
 */
@Slf4j
public class EmulatedQueryExecutor implements QueryExecutor {

    private static final String DATE_COLUMN = "fulldate";

    private final Supplier<TableBackend> backend;
    private final ResultNormalizer normalizer;
    private final int maxRows;
    private final int maxLookupKeys;

    public EmulatedQueryExecutor(Supplier<TableBackend> backend,
                                 ResultNormalizer normalizer,
                                 int maxRows,
                                 int maxLookupKeys) {
        this.backend = backend;
        this.normalizer = normalizer;
        this.maxRows = maxRows;
        this.maxLookupKeys = maxLookupKeys;
    }

    @Override
    public ExecutorKind kind() {
        return ExecutorKind.EMULATED;
    }

    @Override
    public ExecutionResult execute(QueryPlan plan) {
        if (plan.isGrouped()) {
            throw unsupported(plan, "grouped aggregation needs a server-side GROUP BY");
        }
        if (plan.getKind() == PlanKind.AGGREGATE && plan.getShape() == ResultShape.ROWS) {
            throw unsupported(plan, "ungrouped row aggregates are not emulated");
        }

        TableBackend tables = backend.get();
        List<DegradedLookup> degradations = new ArrayList<>();
        RawResult raw;
        switch (plan.getKind()) {
            case AGGREGATE:
                PlanBranch branch = plan.primary();
                Measure measure = branch.measure(plan.getResultAlias()).orElseThrow(() ->
                        unsupported(plan, "no scalar measure"));
                raw = RawResult.scalar(aggregate(plan, branch, measure, tables, degradations), degradations);
                break;
            case RATIO:
                raw = RawResult.scalar(ratio(plan, tables, degradations), degradations);
                break;
            case LISTING:
                raw = RawResult.rows(listing(plan, tables, degradations), degradations);
                break;
            default:
                throw unsupported(plan, "unknown plan kind " + plan.getKind());
        }

        if (!degradations.isEmpty()) {
            log.warn("Plan {} completed with {} degraded lookup(s); result may under-count",
                    plan.getName(), degradations.size());
        }
        return normalizer.normalize(plan, raw);
    }

    private Double ratio(QueryPlan plan, TableBackend tables, List<DegradedLookup> degradations) {
        PlanBranch numeratorBranch = plan.getBranches().get(0);
        PlanBranch denominatorBranch = plan.getBranches().get(1);
        double numerator = asDouble(aggregate(plan, numeratorBranch,
                numeratorBranch.getMeasures().get(0), tables, degradations));
        double denominator = asDouble(aggregate(plan, denominatorBranch,
                denominatorBranch.getMeasures().get(0), tables, degradations));
        if (denominator == 0.0) {
            return 0.0;
        }
        return numerator * 100.0 / denominator;
    }

    /**
     * @return the measure's value, or null when nothing matched and the measure has no
     * natural zero (the normalizer substitutes the default)
     */
    private Object aggregate(QueryPlan plan,
                             PlanBranch branch,
                             Measure measure,
                             TableBackend tables,
                             List<DegradedLookup> degradations) {
        Optional<List<TableFilter>> filters = resolveFilters(plan, branch, tables, degradations);
        if (filters.isEmpty()) {
            return null;
        }
        return measureValue(plan, branch, measure, filters.get(), tables);
    }

    private Object measureValue(QueryPlan plan,
                                PlanBranch branch,
                                Measure measure,
                                List<TableFilter> filters,
                                TableBackend tables) {
        FactRef fact = branch.getFact();
        switch (measure.getKind()) {
            case COUNT: {
                List<TableFilter> counted = new ArrayList<>(filters);
                if (measure.getColumn() != null && !measure.getColumn().equals(fact.getKeyColumn())) {
                    counted.add(TableFilter.notNull(measure.getColumn()));
                }
                return count(fact, counted, tables);
            }
            case COUNT_IF: {
                List<TableFilter> counted = new ArrayList<>(filters);
                counted.add(TableFilter.eq(measure.getColumn(), true));
                return count(fact, counted, tables);
            }
            case COUNT_DISTINCT: {
                Set<Object> distinct = new HashSet<>();
                for (Object value : fetchColumn(plan, fact, measure.getColumn(), filters, tables)) {
                    if (value != null) {
                        distinct.add(value);
                    }
                }
                return (long) distinct.size();
            }
            case SUM: {
                BigDecimal sum = null;
                for (Object value : fetchColumn(plan, fact, measure.getColumn(), filters, tables)) {
                    if (value != null) {
                        sum = (sum == null ? BigDecimal.ZERO : sum).add(decimal(value));
                    }
                }
                return sum;
            }
            case AVG: {
                BigDecimal sum = BigDecimal.ZERO;
                long n = 0;
                for (Object value : fetchColumn(plan, fact, measure.getColumn(), filters, tables)) {
                    if (value != null) {
                        sum = sum.add(decimal(value));
                        n++;
                    }
                }
                return n == 0 ? null : sum.doubleValue() / n;
            }
            case RATE: {
                double numerator = asDouble(measureValue(plan, branch, referenced(plan, branch, measure.getNumerator()), filters, tables));
                double denominator = asDouble(measureValue(plan, branch, referenced(plan, branch, measure.getDenominator()), filters, tables));
                return denominator == 0.0 ? null : numerator * 100.0 / denominator;
            }
            default:
                throw unsupported(plan, "measure " + measure.getKind());
        }
    }

    private List<Map<String, Object>> listing(QueryPlan plan, TableBackend tables, List<DegradedLookup> degradations) {
        PlanBranch branch = plan.primary();
        FactRef fact = branch.getFact();

        Map<String, String> columnsByAlias = new LinkedHashMap<>();
        for (Projection selection : plan.getSelections()) {
            if (selection.getTable() != fact || selection.getColumn().isDerived()) {
                throw unsupported(plan, "listing column " + selection.getColumn() + " is not a plain fact column");
            }
            columnsByAlias.put(selection.getAlias(), selection.getColumn().getName());
        }

        Optional<List<TableFilter>> filters = resolveFilters(plan, branch, tables, degradations);
        if (filters.isEmpty()) {
            return Collections.emptyList();
        }

        List<TableOrder> ordering = new ArrayList<>();
        for (OrderBy order : plan.getOrderBy()) {
            ordering.add(new TableOrder(columnsByAlias.get(order.getAlias()), order.isDescending()));
        }

        TableQuery.TableQueryBuilder query = TableQuery.builder()
                .table(fact.getTableName())
                .columns(columnsByAlias.values())
                .filters(filters.get());

        BackendCapabilities capabilities = tables.capabilities();
        List<Map<String, Object>> rows;
        if (capabilities.isOrdering() && capabilities.isPagination() && plan.pagination().isPresent()) {
            query.ordering(ordering)
                    .offset(plan.getPagination().getOffset())
                    .limit(plan.getPagination().getLimit());
            rows = tables.select(query.build()).getRows();
        } else {
            long total = count(fact, filters.get(), tables);
            if (total > maxRows) {
                throw unsupported(plan, total + " rows exceed the client-side cap of " + maxRows);
            }
            rows = new ArrayList<>(tables.select(query.limit((int) total).build()).getRows());
            rows.sort(comparator(ordering));
            if (plan.pagination().isPresent()) {
                int from = Math.min(plan.getPagination().getOffset(), rows.size());
                int to = Math.min(from + plan.getPagination().getLimit(), rows.size());
                rows = rows.subList(from, to);
            }
        }

        List<Map<String, Object>> records = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> record = new LinkedHashMap<>();
            columnsByAlias.forEach((alias, column) -> record.put(alias, row.get(column)));
            records.add(record);
        }
        return records;
    }

    /**
     * Fact-native filters for a branch. Empty when a dimension lookup matched nothing
     * (or failed), meaning the branch selects no fact rows.
     */
    private Optional<List<TableFilter>> resolveFilters(QueryPlan plan,
                                                       PlanBranch branch,
                                                       TableBackend tables,
                                                       List<DegradedLookup> degradations) {
        FactRef fact = branch.getFact();
        List<TableFilter> filters = new ArrayList<>();
        Map<DimensionRef, List<Predicate>> lookups = new LinkedHashMap<>();

        for (Predicate predicate : branch.getPredicates()) {
            if (predicate.getColumn().isDerived()) {
                throw unsupported(plan, "derived column " + predicate.getColumn() + " cannot be filtered");
            }
            if (predicate.getTable() == fact) {
                filters.add(filter(plan, predicate.getColumn().getName(), predicate));
            } else if (isDateBound(predicate)) {
                filters.add(dateKeyFilter(plan, fact, predicate));
            } else {
                lookups.computeIfAbsent((DimensionRef) predicate.getTable(), dimension -> new ArrayList<>())
                        .add(predicate);
            }
        }

        for (Map.Entry<DimensionRef, List<Predicate>> lookup : lookups.entrySet()) {
            Optional<Set<Object>> keys = lookupKeys(plan, lookup.getKey(), lookup.getValue(), tables, degradations);
            if (keys.isEmpty() || keys.get().isEmpty()) {
                log.debug("Plan {} short-circuits: no {} rows match", plan.getName(), lookup.getKey().getTableName());
                return Optional.empty();
            }
            String foreignKey = fact.requireForeignKey(lookup.getKey());
            filters.add(keys.get().size() == 1
                    ? TableFilter.eq(foreignKey, keys.get().iterator().next())
                    : TableFilter.in(foreignKey, keys.get()));
        }

        // inner-join semantics for joins that carry no predicate
        for (DimensionRef join : branch.getJoins()) {
            if (!lookups.containsKey(join) && join.getKind() != DimensionKind.DATE) {
                filters.add(TableFilter.notNull(fact.requireForeignKey(join)));
            }
        }
        return Optional.of(filters);
    }

    private Optional<Set<Object>> lookupKeys(QueryPlan plan,
                                             DimensionRef dimension,
                                             List<Predicate> predicates,
                                             TableBackend tables,
                                             List<DegradedLookup> degradations) {
        TableQuery.TableQueryBuilder query = TableQuery.builder()
                .table(dimension.getTableName())
                .column(dimension.getKeyColumn())
                .limit(maxLookupKeys + 1);
        StringBuilder columns = new StringBuilder();
        for (Predicate predicate : predicates) {
            query.filter(filter(plan, predicate.getColumn().getName(), predicate));
            columns.append(columns.length() == 0 ? "" : ",").append(predicate.getColumn().getName());
        }

        TableResult result;
        try {
            result = tables.select(query.build());
        } catch (BackendQueryException e) {
            log.warn("Key lookup on {} for plan {} failed, treating as no match: {}",
                    dimension.getTableName(), plan.getName(), e.getMessage());
            degradations.add(new DegradedLookup(dimension.getTableName(), columns.toString(), e.getMessage()));
            return Optional.empty();
        }

        Set<Object> keys = new LinkedHashSet<>();
        for (Map<String, Object> row : result.getRows()) {
            Object key = row.get(dimension.getKeyColumn());
            if (key != null) {
                keys.add(key);
            }
        }
        if (keys.size() > maxLookupKeys) {
            throw unsupported(plan, dimension.getTableName() + " lookup matches more than " + maxLookupKeys + " keys");
        }
        return Optional.of(keys);
    }

    private boolean isDateBound(Predicate predicate) {
        return predicate.getTable() instanceof DimensionRef
                && ((DimensionRef) predicate.getTable()).getKind() == DimensionKind.DATE
                && predicate.getColumn().getName().equals(DATE_COLUMN)
                && predicate.isBound();
    }

    /**
     * Date keys are {@code yyyyMMdd} integers, so a full-date bound is the same bound on
     * the fact's own date key and needs no lookup.
     */
    private TableFilter dateKeyFilter(QueryPlan plan, FactRef fact, Predicate predicate) {
        Object value = plan.parameter(predicate);
        LocalDate date = value instanceof LocalDate ? (LocalDate) value : LocalDate.parse(value.toString());
        int dateKey = WarehouseSchema.toDateKey(date);
        switch (predicate.getOperator()) {
            case EQ:
                return TableFilter.eq(fact.getDateKeyColumn(), dateKey);
            case GTE:
                return TableFilter.gte(fact.getDateKeyColumn(), dateKey);
            case LTE:
                return TableFilter.lte(fact.getDateKeyColumn(), dateKey);
            default:
                throw unsupported(plan, "date operator " + predicate.getOperator());
        }
    }

    private TableFilter filter(QueryPlan plan, String column, Predicate predicate) {
        switch (predicate.getOperator()) {
            case EQ:
                return TableFilter.eq(column, plan.parameter(predicate));
            case GTE:
                return TableFilter.gte(column, plan.parameter(predicate));
            case LTE:
                return TableFilter.lte(column, plan.parameter(predicate));
            case NOT_NULL:
                return TableFilter.notNull(column);
            default:
                throw unsupported(plan, "operator " + predicate.getOperator());
        }
    }

    private long count(FactRef fact, List<TableFilter> filters, TableBackend tables) {
        TableResult result = tables.select(TableQuery.builder()
                .table(fact.getTableName())
                .column(fact.getKeyColumn())
                .filters(filters)
                .countOnly(true)
                .build());
        return result.getTotalCount() == null ? 0L : result.getTotalCount();
    }

    private List<Object> fetchColumn(QueryPlan plan,
                                     FactRef fact,
                                     String column,
                                     List<TableFilter> filters,
                                     TableBackend tables) {
        long total = count(fact, filters, tables);
        if (total > maxRows) {
            throw unsupported(plan, total + " rows of " + fact.getTableName() + " exceed the client-side cap of " + maxRows);
        }
        if (total == 0) {
            return Collections.emptyList();
        }
        TableResult result = tables.select(TableQuery.builder()
                .table(fact.getTableName())
                .column(column)
                .filters(filters)
                .limit((int) total)
                .build());
        List<Object> values = new ArrayList<>(result.getRows().size());
        result.getRows().forEach(row -> values.add(row.get(column)));
        return values;
    }

    private Measure referenced(QueryPlan plan, PlanBranch branch, String alias) {
        return branch.measure(alias).orElseThrow(() -> unsupported(plan, "rate refers to unknown measure " + alias));
    }

    /**
     * Ascending puts NULLs last and descending puts them first, as PostgreSQL does.
     */
    private Comparator<Map<String, Object>> comparator(List<TableOrder> ordering) {
        Comparator<Map<String, Object>> comparator = (left, right) -> 0;
        for (TableOrder order : ordering) {
            Comparator<Map<String, Object>> byColumn = (left, right) -> {
                Object a = left.get(order.getColumn());
                Object b = right.get(order.getColumn());
                if (a == null || b == null) {
                    return a == null ? (b == null ? 0 : 1) : -1;
                }
                return compareValues(a, b);
            };
            comparator = comparator.thenComparing(order.isDescending() ? byColumn.reversed() : byColumn);
        }
        return comparator;
    }

    /**
     * Decoded JSON may carry one numeric column as a mix of Integer, Long and Double.
     */
    static int compareValues(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return decimal(a).compareTo(decimal(b));
        }
        if (a instanceof Boolean && b instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        if (a instanceof LocalDateTime && b instanceof LocalDateTime) {
            return ((LocalDateTime) a).compareTo((LocalDateTime) b);
        }
        if (a instanceof LocalDate && b instanceof LocalDate) {
            return ((LocalDate) a).compareTo((LocalDate) b);
        }
        // ISO-8601 text sorts chronologically
        return a.toString().compareTo(b.toString());
    }

    private static BigDecimal decimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        return new BigDecimal(value.toString());
    }

    private static double asDouble(Object value) {
        if (value == null) {
            return 0.0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    private UnsupportedPlanException unsupported(QueryPlan plan, String reason) {
        return new UnsupportedPlanException(ExecutorKind.EMULATED, "Plan " + plan.getName() + ": " + reason);
    }
}
