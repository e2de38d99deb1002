package com.incarts.analytics.domain.filter;

import com.incarts.analytics.domain.schema.TableRef;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The optional predicates supplied by one request.
 *
 * Equality filters keep their insertion order; the plan builder binds parameters in
 * that order. Blank or null values are treated as "not supplied" and never become
 * filters.
 */
public final class FilterSet {

    private static final FilterSet EMPTY = builder().build();

    private final DateRange dateRange;
    private final List<EqualityFilter> equalityFilters;
    private final Set<FlagFilter> flagFilters;
    private final ColumnSelector groupBy;
    private final Pagination pagination;

    private FilterSet(Builder builder) {
        this.dateRange = builder.dateRange;
        this.equalityFilters = Collections.unmodifiableList(new ArrayList<>(builder.equalityFilters));
        this.flagFilters = Collections.unmodifiableSet(new LinkedHashSet<>(builder.flagFilters));
        this.groupBy = builder.groupBy;
        this.pagination = builder.pagination;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FilterSet empty() {
        return EMPTY;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public List<EqualityFilter> getEqualityFilters() {
        return equalityFilters;
    }

    public Set<FlagFilter> getFlagFilters() {
        return flagFilters;
    }

    public Optional<ColumnSelector> getGroupBy() {
        return Optional.ofNullable(groupBy);
    }

    public Optional<Pagination> getPagination() {
        return Optional.ofNullable(pagination);
    }

    /**
     * Stable textual form of the predicates, used for cache keys. Pagination is included
     * since it changes row results.
     */
    public String describe() {
        StringBuilder description = new StringBuilder();
        description.append("from=").append(dateRange.getStart())
                .append(":to=").append(dateRange.getEnd());
        for (EqualityFilter filter : equalityFilters) {
            description.append(':').append(filter);
        }
        for (FlagFilter flag : flagFilters) {
            description.append(':').append(flag);
        }
        if (groupBy != null) {
            description.append(":by=").append(groupBy);
        }
        if (pagination != null) {
            description.append(":offset=").append(pagination.getOffset())
                    .append(":limit=").append(pagination.getLimit());
        }
        return description.toString();
    }

    @Override
    public String toString() {
        return "FilterSet[" + describe() + "]";
    }

    public static final class Builder {

        private DateRange dateRange = DateRange.unbounded();
        private final List<EqualityFilter> equalityFilters = new ArrayList<>();
        private final Set<FlagFilter> flagFilters = new LinkedHashSet<>();
        private ColumnSelector groupBy;
        private Pagination pagination;

        private Builder() {
        }

        public Builder dateRange(LocalDate start, LocalDate end) {
            this.dateRange = DateRange.of(start, end);
            return this;
        }

        public Builder dateRange(DateRange dateRange) {
            this.dateRange = dateRange != null ? dateRange : DateRange.unbounded();
            return this;
        }

        public Builder equalTo(TableRef table, String column, Object value) {
            if (value == null) {
                return this;
            }
            if (value instanceof String) {
                String text = ((String) value).trim();
                if (text.isEmpty()) {
                    return this;
                }
                value = text;
            }
            equalityFilters.add(new EqualityFilter(table, column, value));
            return this;
        }

        public Builder flag(String column, boolean value) {
            flagFilters.add(new FlagFilter(column, value));
            return this;
        }

        public Builder groupBy(TableRef table, String column) {
            this.groupBy = new ColumnSelector(table, column);
            return this;
        }

        public Builder pagination(Pagination pagination) {
            this.pagination = pagination;
            return this;
        }

        public FilterSet build() {
            return new FilterSet(this);
        }
    }
}
