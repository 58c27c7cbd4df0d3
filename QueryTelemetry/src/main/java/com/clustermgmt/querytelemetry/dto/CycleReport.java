package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Summary of one collection cycle, returned by the manual collect endpoint and
 * kept as the last cycle of each poll loop.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CycleReport {

    private long targetId;
    private Instant startedAt;
    private Instant finishedAt;

    /** False when the snapshot could not be fetched. */
    private boolean sourceAvailable;

    private String sourceError;
    private int rowsFetched;
    private int rowsIngested;
    private int rowsFailed;
    private int newCanonicals;
    private int newSamples;
}
