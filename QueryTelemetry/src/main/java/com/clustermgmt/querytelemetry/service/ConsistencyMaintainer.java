package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;

/**
 * Keeps the derived counters of canonical_queries equal to a live aggregation of
 * their query_samples children.
 *
 * Counters are always recomputed from scratch, never incremented.
 */
@Service
@Slf4j
public class ConsistencyMaintainer {

    private static final String RECOMPUTE_COLUMNS =
        "UPDATE canonical_queries SET " +
        "distinct_variant_count = (SELECT COUNT(DISTINCT s.raw_fingerprint) FROM query_samples s " +
        "WHERE s.id_canonical_query = canonical_queries.id_canonical_query), " +
        "instance_count = (SELECT COUNT(*) FROM query_samples s " +
        "WHERE s.id_canonical_query = canonical_queries.id_canonical_query), " +
        "updated_at = ? ";

    private final DbSession dbSession;
    private final Clock clock;

    public ConsistencyMaintainer(DbSession dbSession, Clock clock) {
        this.dbSession = dbSession;
        this.clock = clock;
    }

    /**
     * Recalculates distinct_variant_count and instance_count of one canonical query.
     * Runs on the caller's connection and transaction when there is one.
     */
    public void recompute(long canonicalQueryId) {
        dbSession.withConnection(() -> {
            Base.exec(RECOMPUTE_COLUMNS + "WHERE id_canonical_query = ?",
                Timestamps.of(clock.instant()), canonicalQueryId);
        });
    }

    /**
     * Takes the row locks of the given canonical queries, in id order, for the rest of the
     * caller's transaction. Writers that change the children of a canonical lock it first,
     * so an ingestion racing with a prune or a merge is serialized on the parent row.
     */
    public void lock(Collection<Long> canonicalQueryIds) {
        if (canonicalQueryIds.isEmpty()) {
            return;
        }
        String in = String.join(", ", Collections.nCopies(canonicalQueryIds.size(), "?"));
        dbSession.withConnection(() -> {
            Base.firstColumn("SELECT id_canonical_query FROM canonical_queries WHERE id_canonical_query IN (" + in +
                ") ORDER BY id_canonical_query FOR UPDATE", canonicalQueryIds.toArray());
        });
    }

    /**
     * Recalculates the counters of every canonical query of a target.
     *
     * @return number of canonical rows rewritten
     */
    public int recomputeTarget(long targetId) {
        int updated = dbSession.inTransaction(() ->
            Base.exec(RECOMPUTE_COLUMNS + "WHERE id_target = ?", Timestamps.of(clock.instant()), targetId));
        log.info("Recounted {} canonical queries of target {}", updated, targetId);
        return updated;
    }
}
