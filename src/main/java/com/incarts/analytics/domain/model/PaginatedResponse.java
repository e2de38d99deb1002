package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of a ranked table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginatedResponse<T> {

    private long totalItems;
    private List<T> items;
    private int page;
    private int size;
    private int totalPages;
    private boolean degraded;

    public static <T> PaginatedResponse<T> of(List<T> items, long totalItems, int page, int size, boolean degraded) {
        return PaginatedResponse.<T>builder()
                .totalItems(totalItems)
                .items(items)
                .page(page)
                .size(size)
                .totalPages(totalPages(totalItems, size))
                .degraded(degraded)
                .build();
    }

    public static int totalPages(long totalItems, int size) {
        if (size <= 0) {
            return 0;
        }
        return (int) ((totalItems + size - 1) / size);
    }
}
