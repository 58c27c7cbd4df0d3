package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.dto.DuplicateGroup;
import com.clustermgmt.querytelemetry.dto.ReconciliationReport;
import com.clustermgmt.querytelemetry.exception.ErrorKind;
import com.clustermgmt.querytelemetry.normalize.QueryCanonicalizer;
import com.clustermgmt.querytelemetry.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Merges canonical rows of a target that share the same canonical text.
 *
 * Each group is merged in its own transaction; a failing group is rolled back and
 * reported while the remaining groups are still processed. Re-running finds nothing.
 */
@Service
@Slf4j
public class DuplicateReconciler {

    private static final String DUPLICATE_TEXTS_SQL =
        "SELECT canonical_text FROM canonical_queries WHERE id_target = ? " +
        "GROUP BY canonical_text HAVING COUNT(*) > 1 ORDER BY canonical_text";

    /** Winner first: most recently seen, then most samples, then oldest id. */
    private static final String GROUP_MEMBERS_SQL =
        "SELECT c.id_canonical_query, c.first_seen_at, c.is_known, c.id_query_group, " +
        "(SELECT COUNT(*) FROM query_samples s WHERE s.id_canonical_query = c.id_canonical_query) AS sample_count " +
        "FROM canonical_queries c WHERE c.id_target = ? AND c.canonical_text = ? " +
        "ORDER BY c.last_seen_at DESC NULLS LAST, sample_count DESC, c.id_canonical_query ASC";

    private final DbSession dbSession;
    private final ConsistencyMaintainer consistencyMaintainer;
    private final QueryCanonicalizer canonicalizer;
    private final Clock clock;

    public DuplicateReconciler(DbSession dbSession,
                               ConsistencyMaintainer consistencyMaintainer,
                               QueryCanonicalizer canonicalizer,
                               Clock clock) {
        this.dbSession = dbSession;
        this.consistencyMaintainer = consistencyMaintainer;
        this.canonicalizer = canonicalizer;
        this.clock = clock;
    }

    /**
     * Read-only report of the duplicate groups of a target.
     */
    public List<DuplicateGroup> findDuplicateGroups(long targetId) {
        return dbSession.withConnection(() -> {
            List<DuplicateGroup> groups = new ArrayList<>();
            for (Object text : Base.firstColumn(DUPLICATE_TEXTS_SQL, targetId)) {
                List<Long> ids = RetentionPruner.toLongs(Base.firstColumn(
                    "SELECT id_canonical_query FROM canonical_queries WHERE id_target = ? AND canonical_text = ? " +
                    "ORDER BY id_canonical_query", targetId, text));
                groups.add(DuplicateGroup.builder()
                    .canonicalText((String) text)
                    .canonicalQueryIds(ids)
                    .build());
            }
            return groups;
        });
    }

    /**
     * @return number of groups merged
     */
    public int reconcileDuplicates(long targetId) {
        return reconcile(targetId).getGroupsMerged();
    }

    public ReconciliationReport reconcile(long targetId) {
        List<String> texts = dbSession.withConnection(() -> {
            List<String> found = new ArrayList<>();
            for (Object text : Base.firstColumn(DUPLICATE_TEXTS_SQL, targetId)) {
                found.add((String) text);
            }
            return found;
        });

        ReconciliationReport report = ReconciliationReport.builder()
            .targetId(targetId)
            .groupsFound(texts.size())
            .build();

        for (String text : texts) {
            try {
                GroupMerge merge = dbSession.inTransaction(() -> mergeGroup(targetId, text));
                if (merge != null) {
                    report.setGroupsMerged(report.getGroupsMerged() + 1);
                    report.setRowsDeleted(report.getRowsDeleted() + merge.rowsDeleted());
                    report.setSamplesMoved(report.getSamplesMoved() + merge.samplesMoved());
                }
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to merge duplicates of target {} ({}): {}",
                    ErrorKind.CONFLICTING_CANONICAL, targetId, abbreviate(text), e.getMessage());
                report.getFailures().add(abbreviate(text) + ": " + e.getMessage());
            }
        }

        if (report.getGroupsFound() > 0) {
            log.info("Reconciled target {}: {} duplicate groups found, {} merged, {} rows deleted, {} samples moved",
                targetId, report.getGroupsFound(), report.getGroupsMerged(),
                report.getRowsDeleted(), report.getSamplesMoved());
        }
        return report;
    }

    private GroupMerge mergeGroup(long targetId, String canonicalText) {
        // an ingestion adding a sample to a loser must finish before the loser is deleted
        consistencyMaintainer.lock(RetentionPruner.toLongs(Base.firstColumn(
            "SELECT id_canonical_query FROM canonical_queries WHERE id_target = ? AND canonical_text = ?",
            targetId, canonicalText)));
        List<Map> members = Base.findAll(GROUP_MEMBERS_SQL, targetId, canonicalText);
        if (members.size() < 2) {
            // merged concurrently since the group was listed
            return null;
        }

        Map<String, Object> kept = members.get(0);
        long keptId = ((Number) kept.get("id_canonical_query")).longValue();
        List<Long> loserIds = new ArrayList<>();
        Instant firstSeen = Timestamps.toInstant(kept.get("first_seen_at"));
        boolean known = false;
        Object groupId = kept.get("id_query_group");

        for (Map<String, Object> member : members) {
            long id = ((Number) member.get("id_canonical_query")).longValue();
            if (id != keptId) {
                loserIds.add(id);
            }
            Instant memberFirstSeen = Timestamps.toInstant(member.get("first_seen_at"));
            if (memberFirstSeen != null && (firstSeen == null || memberFirstSeen.isBefore(firstSeen))) {
                firstSeen = memberFirstSeen;
            }
            known |= Boolean.TRUE.equals(member.get("is_known"));
            if (groupId == null) {
                groupId = member.get("id_query_group");
            }
        }

        String in = String.join(", ", Collections.nCopies(loserIds.size(), "?"));
        List<Object> params = new ArrayList<>();
        params.add(keptId);
        params.addAll(loserIds);
        int moved = Base.exec(
            "UPDATE query_samples SET id_canonical_query = ? WHERE id_canonical_query IN (" + in + ")",
            params.toArray());
        int deleted = Base.exec(
            "DELETE FROM canonical_queries WHERE id_canonical_query IN (" + in + ")",
            loserIds.toArray());

        // The survivor takes the fingerprint ingestion computes today for its text
        Base.exec("UPDATE canonical_queries SET canonical_fingerprint = ?, first_seen_at = ?, is_known = ?, " +
                "id_query_group = ?, updated_at = ? WHERE id_canonical_query = ?",
            canonicalizer.fingerprint(canonicalText), Timestamps.of(firstSeen), known, groupId,
            Timestamps.of(clock.instant()), keptId);

        consistencyMaintainer.recompute(keptId);

        log.info("Merged canonical queries {} into {} on target {} ({} samples moved)",
            loserIds, keptId, targetId, moved);
        return new GroupMerge(deleted, moved);
    }

    private static String abbreviate(String text) {
        return StringUtils.abbreviate(text, 80);
    }

    private record GroupMerge(int rowsDeleted, int samplesMoved) {
    }
}
