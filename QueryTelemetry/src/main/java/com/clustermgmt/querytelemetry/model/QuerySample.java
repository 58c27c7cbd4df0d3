package com.clustermgmt.querytelemetry.model;

import com.clustermgmt.querytelemetry.util.Timestamps;
import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.time.Instant;
import java.util.List;

/**
 * ActiveJDBC model for the query_samples table.
 * One row per distinct raw statement text ever observed on a target, holding the
 * statistics of its latest observation.
 */
@Table("query_samples")
@IdName("id_query_sample")
public class QuerySample extends Model {

    static {
        validatePresenceOf(
            "id_canonical_query",
            "id_target",
            "raw_text",
            "raw_fingerprint"
        );
    }

    public static QuerySample findByFingerprint(long targetId, String rawFingerprint) {
        return QuerySample.findFirst(
            "id_target = ? AND raw_fingerprint = ?",
            targetId, rawFingerprint
        );
    }

    public static List<QuerySample> findByCanonical(long canonicalQueryId) {
        return QuerySample.where("id_canonical_query = ?", canonicalQueryId)
            .orderBy("collected_at DESC, id_query_sample DESC");
    }

    public long getCanonicalQueryId() {
        return getLong("id_canonical_query");
    }

    public long getTargetId() {
        return getLong("id_target");
    }

    public String getRawText() {
        return getString("raw_text");
    }

    public String getRawFingerprint() {
        return getString("raw_fingerprint");
    }

    public long getCalls() {
        Long calls = getLong("calls");
        return calls != null ? calls : 0L;
    }

    public double getTotalTime() {
        Double total = getDouble("total_time");
        return total != null ? total : 0d;
    }

    public Double getMinTime() {
        return getDouble("min_time");
    }

    public Double getMaxTime() {
        return getDouble("max_time");
    }

    public Double getMeanTime() {
        return getDouble("mean_time");
    }

    public Instant getCollectedAt() {
        return Timestamps.toInstant(get("collected_at"));
    }

    public Instant getLastUpdatedAt() {
        return Timestamps.toInstant(get("last_updated_at"));
    }
}
