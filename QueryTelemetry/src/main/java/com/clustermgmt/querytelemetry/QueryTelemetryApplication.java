package com.clustermgmt.querytelemetry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * QueryTelemetry - Query Telemetry Collection and Normalization
 *
 * Periodically samples pg_stat_statements of monitored databases, reduces
 * structurally identical statements to a canonical shape and keeps
 * per-shape statistics consistent as samples are inserted, updated and pruned.
 *
 * Features:
 * - One cancellable poll loop per monitored target
 * - IN-list aware canonicalization with stable MD5 fingerprints
 * - Atomic insert-or-fetch of canonical shapes
 * - Duplicate reconciliation and retention pruning
 * - REST control surface for the dashboard
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class QueryTelemetryApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueryTelemetryApplication.class, args);
    }
}
