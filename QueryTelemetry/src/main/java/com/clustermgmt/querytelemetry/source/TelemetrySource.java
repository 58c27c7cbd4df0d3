package com.clustermgmt.querytelemetry.source;

import java.util.List;

/**
 * Read-only accessor of a monitored target's live statement statistics.
 *
 * Row count and ordering are not stable across calls; rows are identified by exact
 * raw text only.
 */
public interface TelemetrySource {

    /**
     * @throws com.clustermgmt.querytelemetry.exception.TelemetryException of kind
     *         SOURCE_UNAVAILABLE when the target cannot be read
     */
    List<SnapshotRow> fetchSnapshot(long targetId);
}
