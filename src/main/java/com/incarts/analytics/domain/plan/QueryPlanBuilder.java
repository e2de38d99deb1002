package com.incarts.analytics.domain.plan;

import com.incarts.analytics.domain.exception.InvalidFilterException;
import com.incarts.analytics.domain.filter.ColumnSelector;
import com.incarts.analytics.domain.filter.DateRange;
import com.incarts.analytics.domain.filter.EqualityFilter;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.FlagFilter;
import com.incarts.analytics.domain.schema.ColumnRef;
import com.incarts.analytics.domain.schema.ColumnType;
import com.incarts.analytics.domain.schema.DimensionRef;
import com.incarts.analytics.domain.schema.FactRef;
import com.incarts.analytics.domain.schema.TableRef;
import com.incarts.analytics.domain.schema.WarehouseSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Combines a {@link QueryTemplate} with a request's {@link FilterSet} into a
 * {@link QueryPlan}.
 *
 * Parameter assignment is the only place positions are decided. Within a branch values
 * are bound in this order:
 * 1. equality filters, in FilterSet order
 * 2. request flag filters
 * 3. date range start, then end (each only when present)
 * 4. the template's fixed flags
 *
 * A ratio binds its numerator branch first and its denominator branch second, drawing
 * from the same sequence, so a date range shared by both halves occupies two distinct
 * positions.
 *
 * Every check runs before the first position is handed out; an invalid request never
 * produces a plan.
 */
@Slf4j
@Component
public class QueryPlanBuilder {

    private static final String DATE_COLUMN = "fulldate";

    public QueryPlan build(QueryTemplate template, FilterSet filters) {
        validate(template, filters);

        ParameterSequence parameters = new ParameterSequence();
        PlanKind kind = template.kind();

        List<Projection> groupBy = resolveGroups(template, filters);
        List<Projection> outputs = new ArrayList<>(groupBy);
        outputs.addAll(template.getSelections());
        List<Projection> nonNullGroups = template.isExcludeNullGroups() ? groupBy : Collections.emptyList();

        List<PlanBranch> branches = new ArrayList<>();
        branches.add(buildBranch(kind == PlanKind.RATIO ? "numerator" : "primary",
                template.getPrimary(), filters, parameters, outputs, nonNullGroups));
        template.denominatorBranch().ifPresent(denominator -> branches.add(buildBranch("denominator",
                denominator, filters, parameters, Collections.emptyList(), Collections.emptyList())));

        QueryPlan plan = QueryPlan.builder()
                .name(template.getName())
                .kind(kind)
                .shape(template.getShape())
                .branches(Collections.unmodifiableList(branches))
                .groupBy(Collections.unmodifiableList(groupBy))
                .selections(template.getSelections())
                .orderBy(resolveOrdering(template, groupBy))
                .pagination(template.getShape() == ResultShape.ROWS ? filters.getPagination().orElse(null) : null)
                .parameters(parameters.values())
                .resultAlias(resultAlias(template))
                .build();

        log.debug("Built plan {} ({}, {}) with {} parameters",
                plan.getName(), plan.getKind(), plan.getShape(), plan.getParameters().size());
        return plan;
    }

    private PlanBranch buildBranch(String name,
                                   BranchTemplate template,
                                   FilterSet filters,
                                   ParameterSequence parameters,
                                   List<Projection> outputs,
                                   List<Projection> nonNullGroups) {
        FactRef fact = template.getFact();
        Set<DimensionRef> joins = new LinkedHashSet<>(template.getMandatoryJoins());
        List<Predicate> predicates = new ArrayList<>();

        for (EqualityFilter filter : filters.getEqualityFilters()) {
            TableRef table = filter.getTable();
            if (table instanceof DimensionRef) {
                joins.add((DimensionRef) table);
            }
            predicates.add(Predicate.bound(table, table.column(filter.getColumn()),
                    PredicateOperator.EQ, parameters.bind(filter.getValue())));
        }

        for (FlagFilter flag : filters.getFlagFilters()) {
            predicates.add(Predicate.bound(fact, fact.column(flag.getColumn()),
                    PredicateOperator.EQ, parameters.bind(flag.isValue())));
        }

        DateRange range = filters.getDateRange();
        if (range.isBounded()) {
            DimensionRef date = WarehouseSchema.DATE;
            joins.add(date);
            ColumnRef fullDate = date.column(DATE_COLUMN);
            range.startBound().ifPresent(start -> predicates.add(
                    Predicate.bound(date, fullDate, PredicateOperator.GTE, parameters.bind(start))));
            range.endBound().ifPresent(end -> predicates.add(
                    Predicate.bound(date, fullDate, PredicateOperator.LTE, parameters.bind(end))));
        }

        for (FlagFilter flag : template.getFixedFlags()) {
            predicates.add(Predicate.bound(fact, fact.column(flag.getColumn()),
                    PredicateOperator.EQ, parameters.bind(flag.isValue())));
        }

        for (Projection output : outputs) {
            if (output.getTable() instanceof DimensionRef) {
                joins.add((DimensionRef) output.getTable());
            }
        }
        for (Projection group : nonNullGroups) {
            predicates.add(Predicate.notNull(group.getTable(), group.getColumn()));
        }

        return new PlanBranch(name, fact,
                Collections.unmodifiableList(new ArrayList<>(joins)),
                Collections.unmodifiableList(predicates),
                template.getMeasures());
    }

    private List<Projection> resolveGroups(QueryTemplate template, FilterSet filters) {
        List<Projection> groups = new ArrayList<>(template.getFixedGroups());
        filters.getGroupBy().ifPresent(selector -> groups.add(new Projection(
                selector.getTable(), selector.getTable().column(selector.getColumn()), template.getSelectorAlias())));
        return groups;
    }

    /**
     * Orderings on an optional group key that the request did not select are dropped.
     */
    private List<OrderBy> resolveOrdering(QueryTemplate template, List<Projection> groupBy) {
        Set<String> available = new LinkedHashSet<>();
        groupBy.forEach(group -> available.add(group.getAlias()));
        template.getSelections().forEach(selection -> available.add(selection.getAlias()));
        template.getPrimary().getMeasures().forEach(measure -> available.add(measure.getAlias()));

        List<OrderBy> ordering = new ArrayList<>();
        for (OrderBy order : template.getOrdering()) {
            if (available.contains(order.getAlias())) {
                ordering.add(order);
            }
        }
        return Collections.unmodifiableList(ordering);
    }

    private String resultAlias(QueryTemplate template) {
        if (template.kind() == PlanKind.RATIO) {
            return template.getRatioAlias();
        }
        if (template.getShape() == ResultShape.SCALAR && !template.getPrimary().getMeasures().isEmpty()) {
            return template.getPrimary().getMeasures().get(0).getAlias();
        }
        return null;
    }

    private void validate(QueryTemplate template, FilterSet filters) {
        if (template.isDateRangeRequired() && !filters.getDateRange().isBounded()) {
            throw new InvalidFilterException(template.getName() + " requires start_date or end_date");
        }

        for (ColumnSelector required : template.getRequiredFilters()) {
            boolean present = filters.getEqualityFilters().stream()
                    .anyMatch(filter -> filter.getTable() == required.getTable()
                            && filter.getColumn().equals(required.getColumn()));
            if (!present) {
                throw new InvalidFilterException(template.getName() + " requires a filter on " + required);
            }
        }

        List<BranchTemplate> branches = new ArrayList<>();
        branches.add(template.getPrimary());
        template.denominatorBranch().ifPresent(branches::add);

        if (filters.getDateRange().isBounded()) {
            for (BranchTemplate branch : branches) {
                if (!branch.getFact().canJoin(WarehouseSchema.DATE)) {
                    throw new InvalidFilterException(template.getName() + " cannot be filtered by date");
                }
            }
        }

        for (EqualityFilter filter : filters.getEqualityFilters()) {
            TableRef table = filter.getTable();
            boolean filterable = table.findColumn(filter.getColumn())
                    .map(ColumnRef::isFilterable)
                    .orElse(false);
            if (!filterable) {
                throw new InvalidFilterException(table.getTableName() + "." + filter.getColumn() + " is not filterable");
            }
            for (BranchTemplate branch : branches) {
                if (!reachable(branch, table)) {
                    throw new InvalidFilterException(template.getName() + " cannot filter on "
                            + table.getTableName() + "." + filter.getColumn());
                }
            }
        }

        for (FlagFilter flag : filters.getFlagFilters()) {
            for (BranchTemplate branch : branches) {
                boolean flagColumn = branch.getFact().findColumn(flag.getColumn())
                        .map(column -> column.isFilterable() && column.getType() == ColumnType.BOOLEAN)
                        .orElse(false);
                if (!flagColumn) {
                    throw new InvalidFilterException(flag.getColumn() + " is not a flag of "
                            + branch.getFact().getTableName());
                }
            }
        }

        if (filters.getGroupBy().isPresent()) {
            ColumnSelector selector = filters.getGroupBy().get();
            if (template.getShape() != ResultShape.ROWS || !template.getSelectableGroups().contains(selector)) {
                throw new InvalidFilterException(template.getName() + " cannot group by " + selector);
            }
            boolean groupable = selector.getTable().findColumn(selector.getColumn())
                    .map(ColumnRef::isGroupable)
                    .orElse(false);
            if (!groupable || !reachable(template.getPrimary(), selector.getTable())) {
                throw new InvalidFilterException(selector + " is not a groupable column joined by " + template.getName());
            }
        } else if (template.isSelectorRequired()) {
            throw new InvalidFilterException(template.getName() + " requires a grouping column");
        }
    }

    private boolean reachable(BranchTemplate branch, TableRef table) {
        if (table instanceof FactRef) {
            return table == branch.getFact();
        }
        return table instanceof DimensionRef && branch.allowsJoin((DimensionRef) table);
    }
}
