package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Single KPI value. {@code degraded} marks a value computed while a dimension lookup failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KpiResponse {

    private Number value;
    private String label;
    private boolean degraded;
}
