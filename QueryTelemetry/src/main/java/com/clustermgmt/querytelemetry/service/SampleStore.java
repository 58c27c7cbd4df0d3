package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.dto.IngestResult;
import com.clustermgmt.querytelemetry.exception.ErrorKind;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.clustermgmt.querytelemetry.model.CanonicalQuery;
import com.clustermgmt.querytelemetry.normalize.QueryCanonicalizer;
import com.clustermgmt.querytelemetry.normalize.QueryCanonicalizer.CanonicalForm;
import com.clustermgmt.querytelemetry.source.QueryStatistics;
import com.clustermgmt.querytelemetry.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.javalite.activejdbc.DBException;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Clock;

/**
 * Durable store of canonical query shapes and their raw-text samples.
 *
 * Both upserts rely on the unique indexes (id_target, canonical_fingerprint) and
 * (id_target, raw_fingerprint): the row is inserted with ON CONFLICT DO NOTHING and
 * then read back, so concurrent writers of the same fingerprint converge on one row.
 */
@Service
@Slf4j
public class SampleStore {

    private static final long RETRY_BACKOFF_MS = 25;

    private static final String INSERT_CANONICAL =
        "INSERT INTO canonical_queries (id_target, canonical_text, canonical_fingerprint, " +
        "first_seen_at, last_seen_at, is_known, distinct_variant_count, instance_count, created_at, updated_at) " +
        "VALUES (?, ?, ?, ?, ?, FALSE, 0, 0, ?, ?) ON CONFLICT DO NOTHING";

    private static final String TOUCH_CANONICAL =
        "UPDATE canonical_queries SET last_seen_at = ?, updated_at = ? WHERE id_canonical_query = ?";

    private static final String INSERT_SAMPLE =
        "INSERT INTO query_samples (id_canonical_query, id_target, raw_text, raw_fingerprint, " +
        "calls, total_time, min_time, max_time, mean_time, collected_at, last_updated_at) " +
        "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) ON CONFLICT DO NOTHING";

    private static final String UPDATE_SAMPLE =
        "UPDATE query_samples SET id_canonical_query = ?, calls = ?, total_time = ?, min_time = ?, " +
        "max_time = ?, mean_time = ?, last_updated_at = ? WHERE id_target = ? AND raw_fingerprint = ?";

    private final QueryCanonicalizer canonicalizer;
    private final ConsistencyMaintainer consistencyMaintainer;
    private final DbSession dbSession;
    private final TelemetryProperties props;
    private final Clock clock;

    public SampleStore(QueryCanonicalizer canonicalizer,
                       ConsistencyMaintainer consistencyMaintainer,
                       DbSession dbSession,
                       TelemetryProperties props,
                       Clock clock) {
        this.canonicalizer = canonicalizer;
        this.consistencyMaintainer = consistencyMaintainer;
        this.dbSession = dbSession;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Records one observation of {@code rawText} on a target.
     *
     * @throws TelemetryException of kind STORE_WRITE_FAILURE once every attempt failed
     */
    public IngestResult ingest(long targetId, String rawText, QueryStatistics statistics) {
        String raw = rawText != null ? rawText : "";
        CanonicalForm form = canonicalizer.canonicalize(raw);
        String rawFingerprint = canonicalizer.fingerprint(raw);

        int maxAttempts = props.getIngest().getMaxAttempts();
        DBException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return dbSession.inTransaction(() -> upsert(targetId, form, raw, rawFingerprint, statistics));
            } catch (DBException e) {
                lastFailure = e;
                log.debug("Ingest attempt {}/{} failed for target {} fingerprint {}: {}",
                    attempt, maxAttempts, targetId, rawFingerprint, e.getMessage());
                if (attempt < maxAttempts) {
                    backoff(attempt, targetId);
                }
            }
        }
        throw new TelemetryException(ErrorKind.STORE_WRITE_FAILURE,
            "Unable to store sample " + rawFingerprint + " of target " + targetId +
                " after " + maxAttempts + " attempts", lastFailure);
    }

    private IngestResult upsert(long targetId, CanonicalForm form, String raw, String rawFingerprint,
                                QueryStatistics statistics) {
        Timestamp now = Timestamps.of(clock.instant());

        int canonicalInserted = Base.exec(INSERT_CANONICAL,
            targetId, form.canonicalText(), form.fingerprint(), now, now, now, now);
        CanonicalQuery canonical = CanonicalQuery.findByFingerprint(targetId, form.fingerprint());
        if (canonical == null) {
            throw new DBException("Canonical query " + form.fingerprint() + " vanished after upsert");
        }
        long canonicalId = canonical.getLongId();
        boolean newCanonical = canonicalInserted > 0;
        if (newCanonical) {
            reportConflictingCanonical(targetId, canonicalId, form.canonicalText());
        } else if (Base.exec(TOUCH_CANONICAL, now, now, canonicalId) == 0) {
            // merged away by the reconciler since the lookup
            throw new DBException("Canonical query " + canonicalId + " was deleted during ingestion");
        }

        Object previousParent = Base.firstCell(
            "SELECT id_canonical_query FROM query_samples WHERE id_target = ? AND raw_fingerprint = ?",
            targetId, rawFingerprint);

        boolean newSample = false;
        if (previousParent == null) {
            newSample = Base.exec(INSERT_SAMPLE,
                canonicalId, targetId, raw, rawFingerprint,
                statistics.calls(), statistics.totalTime(),
                statistics.minTime(), statistics.maxTime(), statistics.meanTime(),
                now, now) > 0;
        }
        if (!newSample) {
            updateSample(targetId, canonicalId, rawFingerprint, statistics, now);
        }

        consistencyMaintainer.recompute(canonicalId);
        if (previousParent != null && ((Number) previousParent).longValue() != canonicalId) {
            // the raw text now canonicalizes to another shape; the old parent lost a child
            consistencyMaintainer.recompute(((Number) previousParent).longValue());
        }

        log.debug("Ingested sample {} -> canonical {} on target {} (newCanonical={}, newSample={})",
            rawFingerprint, canonicalId, targetId, newCanonical, newSample);
        return new IngestResult(canonicalId, newCanonical, newSample);
    }

    /**
     * Overwrites an existing sample. A sample pruned since it was looked up leaves nothing
     * to update; that attempt fails so the retry takes the insert path.
     */
    void updateSample(long targetId, long canonicalId, String rawFingerprint,
                      QueryStatistics statistics, Timestamp now) {
        int updated = Base.exec(UPDATE_SAMPLE,
            canonicalId, statistics.calls(), statistics.totalTime(),
            statistics.minTime(), statistics.maxTime(), statistics.meanTime(),
            now, targetId, rawFingerprint);
        if (updated == 0) {
            throw new DBException("Sample " + rawFingerprint + " of target " + targetId + " was deleted during ingestion");
        }
    }

    private void reportConflictingCanonical(long targetId, long canonicalId, String canonicalText) {
        Object others = Base.firstCell(
            "SELECT COUNT(*) FROM canonical_queries WHERE id_target = ? AND canonical_text = ? AND id_canonical_query <> ?",
            targetId, canonicalText, canonicalId);
        if (others != null && ((Number) others).longValue() > 0) {
            log.warn("[{}] target {} now has {} more canonical row(s) with the text of canonical {}; run reconciliation",
                ErrorKind.CONFLICTING_CANONICAL, targetId, others, canonicalId);
        }
    }

    private void backoff(int attempt, long targetId) {
        try {
            Thread.sleep(RETRY_BACKOFF_MS * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TelemetryException(ErrorKind.STORE_WRITE_FAILURE,
                "Interrupted while retrying a sample of target " + targetId, e);
        }
    }
}
