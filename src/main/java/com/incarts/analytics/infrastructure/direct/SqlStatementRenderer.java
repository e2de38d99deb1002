package com.incarts.analytics.infrastructure.direct;

import com.incarts.analytics.domain.plan.Measure;
import com.incarts.analytics.domain.plan.OrderBy;
import com.incarts.analytics.domain.plan.PlanBranch;
import com.incarts.analytics.domain.plan.PlanKind;
import com.incarts.analytics.domain.plan.Predicate;
import com.incarts.analytics.domain.plan.Projection;
import com.incarts.analytics.domain.plan.QueryPlan;
import com.incarts.analytics.domain.plan.ResultShape;
import com.incarts.analytics.domain.schema.DimensionRef;
import com.incarts.analytics.domain.schema.FactRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders a {@link QueryPlan} into one PostgreSQL statement.
 *
 * Placeholders appear in ascending parameter position, so the bound value list is the
 * plan's parameter list. A predicate out of position order is a planner bug and fails
 * rendering.
 */
@Component
public class SqlStatementRenderer {

    private static final String RATIO_NUMERATOR = "ratio_numerator";
    private static final String RATIO_DENOMINATOR = "ratio_denominator";
    private static final String RATIO_VALUE = "agg_value";

    public SqlStatement render(QueryPlan plan) {
        List<Object> parameters = new ArrayList<>();
        String sql = plan.getKind() == PlanKind.RATIO
                ? renderRatio(plan, parameters)
                : renderSelect(plan, parameters);

        if (parameters.size() != plan.getParameters().size()) {
            throw new IllegalStateException("Plan " + plan.getName() + " declares " + plan.getParameters().size()
                    + " parameters but " + parameters.size() + " placeholders were rendered");
        }
        return new SqlStatement(sql, List.copyOf(parameters));
    }

    private String renderSelect(QueryPlan plan, List<Object> parameters) {
        PlanBranch branch = plan.primary();
        StringJoiner select = new StringJoiner(", ");

        if (plan.getKind() == PlanKind.LISTING) {
            for (Projection selection : plan.getSelections()) {
                select.add(selection.getColumn().sqlExpression() + " AS " + selection.getAlias());
            }
        } else {
            for (Projection group : plan.getGroupBy()) {
                select.add(group.getColumn().sqlExpression() + " AS " + group.getAlias());
            }
            for (Measure measure : branch.getMeasures()) {
                select.add(measureExpression(branch, measure) + " AS " + measure.getAlias());
            }
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(select);
        appendBody(sql, plan, branch, parameters);

        if (plan.isGrouped()) {
            StringJoiner groupBy = new StringJoiner(", ");
            plan.getGroupBy().forEach(group -> groupBy.add(group.getColumn().sqlExpression()));
            sql.append(" GROUP BY ").append(groupBy);
        }

        if (plan.getShape() == ResultShape.ROWS) {
            if (!plan.getOrderBy().isEmpty()) {
                StringJoiner orderBy = new StringJoiner(", ");
                for (OrderBy order : plan.getOrderBy()) {
                    orderBy.add(order.getAlias() + (order.isDescending() ? " DESC" : " ASC"));
                }
                sql.append(" ORDER BY ").append(orderBy);
            }
            plan.pagination().ifPresent(page ->
                    sql.append(" LIMIT ").append(page.getLimit()).append(" OFFSET ").append(page.getOffset()));
        }
        return sql.toString();
    }

    private String renderRatio(QueryPlan plan, List<Object> parameters) {
        PlanBranch numerator = plan.getBranches().get(0);
        PlanBranch denominator = plan.getBranches().get(1);
        return "WITH " + RATIO_NUMERATOR + " AS (" + renderSubAggregate(plan, numerator, parameters) + "), "
                + RATIO_DENOMINATOR + " AS (" + renderSubAggregate(plan, denominator, parameters) + ") "
                + "SELECT COALESCE("
                + "CAST((SELECT " + RATIO_VALUE + " FROM " + RATIO_NUMERATOR + ") AS DOUBLE PRECISION) * 100.0"
                + " / NULLIF((SELECT " + RATIO_VALUE + " FROM " + RATIO_DENOMINATOR + "), 0), 0.0)"
                + " AS " + plan.getResultAlias();
    }

    private String renderSubAggregate(QueryPlan plan, PlanBranch branch, List<Object> parameters) {
        Measure measure = branch.getMeasures().get(0);
        StringBuilder sql = new StringBuilder("SELECT ")
                .append(measureExpression(branch, measure))
                .append(" AS ").append(RATIO_VALUE);
        appendBody(sql, plan, branch, parameters);
        return sql.toString();
    }

    private void appendBody(StringBuilder sql, QueryPlan plan, PlanBranch branch, List<Object> parameters) {
        FactRef fact = branch.getFact();
        sql.append(" FROM ").append(fact.getTableName()).append(' ').append(fact.getAlias());

        for (DimensionRef join : branch.getJoins()) {
            sql.append(" JOIN ").append(join.getTableName()).append(' ').append(join.getAlias())
                    .append(" ON ").append(fact.getAlias()).append('.').append(fact.requireForeignKey(join))
                    .append(" = ").append(join.getAlias()).append('.').append(join.getKeyColumn());
        }

        if (branch.getPredicates().isEmpty()) {
            return;
        }
        StringJoiner where = new StringJoiner(" AND ");
        for (Predicate predicate : branch.getPredicates()) {
            String column = predicate.getColumn().sqlExpression();
            if (!predicate.isBound()) {
                where.add(column + " " + predicate.getOperator().sql());
                continue;
            }
            int expected = parameters.size() + 1;
            if (predicate.getParamIndex() != expected) {
                throw new IllegalStateException("Plan " + plan.getName() + " binds position "
                        + predicate.getParamIndex() + " where " + expected + " was expected");
            }
            parameters.add(plan.parameter(predicate));
            where.add(column + " " + predicate.getOperator().sql() + " ?");
        }
        sql.append(" WHERE ").append(where);
    }

    private String measureExpression(PlanBranch branch, Measure measure) {
        String alias = branch.getFact().getAlias();
        switch (measure.getKind()) {
            case COUNT:
                String counted = measure.getColumn() != null ? measure.getColumn() : branch.getFact().getKeyColumn();
                return "COUNT(" + alias + "." + counted + ")";
            case COUNT_IF:
                return "SUM(CASE WHEN " + alias + "." + measure.getColumn() + " = TRUE THEN 1 ELSE 0 END)";
            case COUNT_DISTINCT:
                return "COUNT(DISTINCT " + alias + "." + measure.getColumn() + ")";
            case SUM:
                return "SUM(" + alias + "." + measure.getColumn() + ")";
            case AVG:
                return "AVG(" + alias + "." + measure.getColumn() + ")";
            case RATE:
                String numerator = measureExpression(branch, referenced(branch, measure.getNumerator()));
                String denominator = measureExpression(branch, referenced(branch, measure.getDenominator()));
                return "(CAST(" + numerator + " AS DOUBLE PRECISION) * 100.0 / NULLIF(" + denominator + ", 0))";
            default:
                throw new IllegalArgumentException("Unhandled measure kind " + measure.getKind());
        }
    }

    private Measure referenced(PlanBranch branch, String alias) {
        return branch.measure(alias).orElseThrow(() ->
                new IllegalStateException("Rate refers to unknown measure " + alias));
    }
}
