package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Category totals, largest first unless the category has a natural order (hours, weekdays).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BreakdownResponse {

    private List<BreakdownItem> data;
}
