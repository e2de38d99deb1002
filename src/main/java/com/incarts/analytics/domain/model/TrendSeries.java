package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One named line of a multi-series trend chart, e.g. "Overall" or a link type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrendSeries {

    private String name;
    private List<TrendDataItem> data;
}
