package com.incarts.analytics.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One raw click of a campaign.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClickLogRow {

    private long clickId;
    private LocalDateTime clickTimestamp;
    private String utmSource;
    private String utmMedium;
    private String utmCampaign;
    private boolean atcClick;
    private double clickValue;
}
