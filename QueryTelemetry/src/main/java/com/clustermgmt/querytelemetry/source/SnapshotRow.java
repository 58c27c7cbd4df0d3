package com.clustermgmt.querytelemetry.source;

/**
 * One row of a telemetry snapshot.
 */
public record SnapshotRow(String rawText, QueryStatistics statistics) {
}
