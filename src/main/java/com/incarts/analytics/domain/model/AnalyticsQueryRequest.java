package com.incarts.analytics.domain.model;

import com.incarts.analytics.domain.exception.InvalidFilterException;
import com.incarts.analytics.domain.filter.FilterSet;
import com.incarts.analytics.domain.filter.Pagination;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Date range and paging parameters shared by every report endpoint.
 *
 * Either date may be absent; a single date is a one-sided range.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyticsQueryRequest {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_SIZE = 20;
    public static final int MAX_SIZE = 100;

    private LocalDate startDate;
    private LocalDate endDate;

    private Integer page;
    private Integer size;

    // Defaults
    public int getPage() {
        return page == null ? DEFAULT_PAGE : page;
    }

    public int getSize() {
        return size == null ? DEFAULT_SIZE : size;
    }

    /**
     * New filter builder carrying this request's date range.
     */
    public FilterSet.Builder filters() {
        return FilterSet.builder().dateRange(startDate, endDate);
    }

    public Pagination pagination() {
        if (getSize() > MAX_SIZE) {
            throw new InvalidFilterException("size must be <= " + MAX_SIZE + ": " + getSize());
        }
        return Pagination.ofPage(getPage(), getSize());
    }
}
