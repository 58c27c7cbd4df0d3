package com.clustermgmt.querytelemetry.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Typed binding for all telemetry.* configuration.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "telemetry")
public class TelemetryProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Source source = new Source();

    @Valid
    private Ingest ingest = new Ingest();

    @Valid
    private Retention retention = new Retention();

    @Valid
    private Maintenance maintenance = new Maintenance();

    @Valid
    private Listing listing = new Listing();

    @Data
    public static class Scheduler {

        /** Threads shared by all per-target poll loops. */
        @Min(1)
        private int poolSize = 4;

        /** Interval used when a start request does not carry one. */
        @Min(1)
        private int defaultIntervalSeconds = 60;

        /** Re-attach loops for sessions a previous process left running. */
        private boolean resumeOnStartup = true;
    }

    @Data
    public static class Source {

        /** Upper bound of one snapshot call (further capped by the session interval). */
        @Min(1)
        private long timeoutMs = 10000;

        /** Rows read from pg_stat_statements per poll. */
        @Min(1)
        private int maxRows = 100;

        /** Monitored target id -> JDBC coordinates. */
        private Map<Long, TargetConnection> targets = new HashMap<>();

        /**
         * Effective timeout for a loop polling every {@code intervalSeconds}:
         * the configured bound, but never more than 3/4 of the interval.
         */
        public Duration timeoutFor(int intervalSeconds) {
            long intervalBound = Math.max(1L, intervalSeconds * 750L);
            return Duration.ofMillis(Math.min(timeoutMs, intervalBound));
        }
    }

    @Data
    public static class TargetConnection {
        private String url;
        private String username;
        private String password;
    }

    @Data
    public static class Ingest {

        /** Attempts per row when the store reports a write conflict. */
        @Min(1)
        private int maxAttempts = 5;
    }

    @Data
    public static class Retention {

        /** Samples not re-observed for this many days are pruned by the maintenance job. */
        @Min(0)
        private int days = 90;

        public Duration horizon() {
            return Duration.ofDays(days);
        }
    }

    @Data
    public static class Maintenance {
        private boolean enabled = true;

        @Min(1)
        private long intervalMinutes = 60;

        /** Also merge duplicate canonical rows on every run. */
        private boolean reconcile = true;
    }

    @Data
    public static class Listing {

        @Min(1)
        private int maxResults = 100;
    }
}
