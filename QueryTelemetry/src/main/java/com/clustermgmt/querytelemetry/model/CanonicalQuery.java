package com.clustermgmt.querytelemetry.model;

import com.clustermgmt.querytelemetry.util.Timestamps;
import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.time.Instant;

/**
 * ActiveJDBC model for the canonical_queries table.
 * One row per distinct query shape of a monitored target.
 *
 * distinct_variant_count and instance_count are derived from query_samples and
 * only written by the consistency maintainer.
 */
@Table("canonical_queries")
@IdName("id_canonical_query")
public class CanonicalQuery extends Model {

    static {
        validatePresenceOf(
            "id_target",
            "canonical_text",
            "canonical_fingerprint"
        );
    }

    public static CanonicalQuery findByFingerprint(long targetId, String fingerprint) {
        return CanonicalQuery.findFirst(
            "id_target = ? AND canonical_fingerprint = ?",
            targetId, fingerprint
        );
    }

    /**
     * Applies a user classification. A null isKnown leaves the flag untouched.
     */
    public void classify(Boolean isKnown, Long groupId, boolean clearGroup, Instant now) {
        if (isKnown != null) {
            set("is_known", isKnown);
        }
        if (clearGroup) {
            set("id_query_group", null);
        } else if (groupId != null) {
            set("id_query_group", groupId);
        }
        set("updated_at", Timestamps.of(now));
        saveIt();
    }

    public long getTargetId() {
        return getLong("id_target");
    }

    public String getCanonicalText() {
        return getString("canonical_text");
    }

    public String getFingerprint() {
        return getString("canonical_fingerprint");
    }

    public boolean isKnown() {
        Boolean known = getBoolean("is_known");
        return known != null && known;
    }

    public Long getGroupId() {
        return getLong("id_query_group");
    }

    public Instant getFirstSeenAt() {
        return Timestamps.toInstant(get("first_seen_at"));
    }

    public Instant getLastSeenAt() {
        return Timestamps.toInstant(get("last_seen_at"));
    }

    public Instant getUpdatedAt() {
        return Timestamps.toInstant(get("updated_at"));
    }

    public int getDistinctVariantCount() {
        Integer count = getInteger("distinct_variant_count");
        return count != null ? count : 0;
    }

    public int getInstanceCount() {
        Integer count = getInteger("instance_count");
        return count != null ? count : 0;
    }
}
