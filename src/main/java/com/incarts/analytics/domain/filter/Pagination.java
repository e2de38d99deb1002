package com.incarts.analytics.domain.filter;

import com.incarts.analytics.domain.exception.InvalidFilterException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Offset/limit window over an ordered row result.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Pagination {

    int offset;
    int limit;

    public static Pagination of(int offset, int limit) {
        if (offset < 0) {
            throw new InvalidFilterException("offset must not be negative: " + offset);
        }
        if (limit < 1) {
            throw new InvalidFilterException("limit must be positive: " + limit);
        }
        return new Pagination(offset, limit);
    }

    /**
     * Offsets past {@link Integer#MAX_VALUE} are clamped; such a page is simply empty.
     *
     * @param page 1-based page number
     * @param size rows per page
     */
    public static Pagination ofPage(int page, int size) {
        if (page < 1) {
            throw new InvalidFilterException("page must be >= 1: " + page);
        }
        if (size < 1) {
            throw new InvalidFilterException("size must be >= 1: " + size);
        }
        long offset = (long) (page - 1) * size;
        return of((int) Math.min(offset, Integer.MAX_VALUE), size);
    }
}
