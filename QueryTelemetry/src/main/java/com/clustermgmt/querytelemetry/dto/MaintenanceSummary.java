package com.clustermgmt.querytelemetry.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Totals of one maintenance pass.
 */
@Data
@NoArgsConstructor
public class MaintenanceSummary {

    private int targets;
    private int failedTargets;
    private int groupsMerged;
    private long samplesDeleted;
    private long childlessCanonicals;
}
