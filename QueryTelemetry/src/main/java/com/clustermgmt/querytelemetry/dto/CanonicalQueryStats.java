package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Statistics of a canonical query aggregated over its live samples.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalQueryStats {

    private long canonicalQueryId;
    private long sampleCount;
    private long totalCalls;
    private double totalTime;
    private Double minTime;
    private Double maxTime;

    /** totalTime / totalCalls, null when nothing was called. */
    private Double avgTime;

    private Instant firstCollectedAt;
    private Instant lastUpdatedAt;
}
