package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.dto.PruneReport;
import com.clustermgmt.querytelemetry.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Deletes samples that have not been re-observed within a retention horizon.
 *
 * Canonical queries are never deleted here, even once childless: they carry the
 * known/group classification of the shape.
 */
@Service
@Slf4j
public class RetentionPruner {

    private final DbSession dbSession;
    private final ConsistencyMaintainer consistencyMaintainer;
    private final Clock clock;

    public RetentionPruner(DbSession dbSession, ConsistencyMaintainer consistencyMaintainer, Clock clock) {
        this.dbSession = dbSession;
        this.consistencyMaintainer = consistencyMaintainer;
        this.clock = clock;
    }

    /**
     * Prunes every target holding samples.
     */
    public PruneReport prune(Duration retentionHorizon) {
        Instant cutoff = cutoff(retentionHorizon);
        List<Long> targets = dbSession.withConnection(() -> toLongs(
            Base.firstColumn("SELECT DISTINCT id_target FROM query_samples ORDER BY id_target")));

        PruneReport total = PruneReport.builder().cutoff(cutoff).build();
        for (Long targetId : targets) {
            PruneReport report = prune(targetId, cutoff);
            total.setDeletedSamples(total.getDeletedSamples() + report.getDeletedSamples());
            total.setAffectedCanonicals(total.getAffectedCanonicals() + report.getAffectedCanonicals());
            total.setChildlessCanonicals(total.getChildlessCanonicals() + report.getChildlessCanonicals());
        }
        return total;
    }

    public PruneReport prune(long targetId, Duration retentionHorizon) {
        return prune(targetId, cutoff(retentionHorizon));
    }

    /**
     * Samples whose lastUpdatedAt is at or before the cutoff are removed, so a zero
     * horizon clears everything ingested up to now.
     */
    private PruneReport prune(long targetId, Instant cutoff) {
        Timestamp cutoffTs = Timestamps.of(cutoff);
        PruneReport report = dbSession.inTransaction(() -> {
            List<Long> affected = toLongs(Base.firstColumn(
                "SELECT DISTINCT id_canonical_query FROM query_samples " +
                "WHERE id_target = ? AND last_updated_at <= ?", targetId, cutoffTs));
            consistencyMaintainer.lock(affected);

            int deleted = Base.exec(
                "DELETE FROM query_samples WHERE id_target = ? AND last_updated_at <= ?", targetId, cutoffTs);

            for (Long canonicalId : affected) {
                consistencyMaintainer.recompute(canonicalId);
            }

            Object childless = Base.firstCell(
                "SELECT COUNT(*) FROM canonical_queries c WHERE c.id_target = ? AND NOT EXISTS " +
                "(SELECT 1 FROM query_samples s WHERE s.id_canonical_query = c.id_canonical_query)", targetId);

            return PruneReport.builder()
                .cutoff(cutoff)
                .deletedSamples(deleted)
                .affectedCanonicals(affected.size())
                .childlessCanonicals(childless != null ? ((Number) childless).longValue() : 0)
                .build();
        });

        if (report.getDeletedSamples() > 0) {
            log.info("Pruned {} samples of target {} older than {} ({} canonical queries updated, {} without samples)",
                report.getDeletedSamples(), targetId, cutoff,
                report.getAffectedCanonicals(), report.getChildlessCanonicals());
        }
        return report;
    }

    private Instant cutoff(Duration retentionHorizon) {
        if (retentionHorizon == null || retentionHorizon.isNegative()) {
            throw new IllegalArgumentException("Retention horizon must be zero or positive");
        }
        return clock.instant().minus(retentionHorizon);
    }

    static List<Long> toLongs(List<?> values) {
        return values.stream()
            .map(v -> ((Number) v).longValue())
            .toList();
    }
}
