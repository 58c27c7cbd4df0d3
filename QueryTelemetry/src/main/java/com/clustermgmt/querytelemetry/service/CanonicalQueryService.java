package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryFilter;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryStats;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryView;
import com.clustermgmt.querytelemetry.dto.ClassificationRequest;
import com.clustermgmt.querytelemetry.dto.QuerySampleView;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.clustermgmt.querytelemetry.model.CanonicalQuery;
import com.clustermgmt.querytelemetry.model.QueryGroup;
import com.clustermgmt.querytelemetry.model.QuerySample;
import com.clustermgmt.querytelemetry.util.Timestamps;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.javalite.activejdbc.Base;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the store and user classification of canonical queries.
 */
@Service
@Slf4j
public class CanonicalQueryService {

    private static final String STATS_SQL =
        "SELECT COUNT(*) AS sample_count, COALESCE(SUM(calls), 0) AS total_calls, " +
        "COALESCE(SUM(total_time), 0) AS total_time, MIN(min_time) AS min_time, MAX(max_time) AS max_time, " +
        "MIN(collected_at) AS first_collected_at, MAX(last_updated_at) AS last_updated_at " +
        "FROM query_samples WHERE id_canonical_query = ?";

    private final DbSession dbSession;
    private final MonitoringScheduler monitoringScheduler;
    private final TelemetryProperties props;
    private final Clock clock;

    public CanonicalQueryService(DbSession dbSession,
                                 MonitoringScheduler monitoringScheduler,
                                 TelemetryProperties props,
                                 Clock clock) {
        this.dbSession = dbSession;
        this.monitoringScheduler = monitoringScheduler;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Canonical queries of a target, most recently seen first.
     */
    public List<CanonicalQueryView> listCanonicalQueries(CanonicalQueryFilter filter) {
        if (filter.isKnownOnly() && filter.isUnknownOnly()) {
            throw new IllegalArgumentException("knownOnly and unknownOnly are mutually exclusive");
        }
        if (filter.getGroupId() != null && filter.isUngroupedOnly()) {
            throw new IllegalArgumentException("groupId and ungroupedOnly are mutually exclusive");
        }
        if (filter.getDateFrom() != null && filter.getDateTo() != null
                && filter.getDateFrom().isAfter(filter.getDateTo())) {
            throw new IllegalArgumentException("dateFrom is after dateTo");
        }

        StringBuilder where = new StringBuilder("id_target = ?");
        List<Object> params = new ArrayList<>();
        params.add(filter.getTargetId());
        appendFilters(where, params, filter);

        return dbSession.withConnection(() -> {
            List<CanonicalQuery> queries = CanonicalQuery.where(where.toString(), params.toArray())
                .orderBy("last_seen_at DESC, id_canonical_query DESC")
                .limit(props.getListing().getMaxResults());
            List<CanonicalQueryView> result = new ArrayList<>();
            for (CanonicalQuery query : queries) {
                result.add(CanonicalQueryView.fromModel(query));
            }
            return result;
        });
    }

    private void appendFilters(StringBuilder where, List<Object> params, CanonicalQueryFilter filter) {
        if (filter.isKnownOnly()) {
            where.append(" AND is_known = ?");
            params.add(Boolean.TRUE);
        }
        if (filter.isUnknownOnly()) {
            where.append(" AND is_known = ?");
            params.add(Boolean.FALSE);
        }
        if (filter.getGroupId() != null) {
            where.append(" AND id_query_group = ?");
            params.add(filter.getGroupId());
        }
        if (filter.isUngroupedOnly()) {
            where.append(" AND id_query_group IS NULL");
        }
        if (filter.getDateFrom() != null) {
            where.append(" AND last_seen_at >= ?");
            params.add(startOfDay(filter.getDateFrom()));
        }
        if (filter.getDateTo() != null) {
            where.append(" AND last_seen_at < ?");
            params.add(startOfDay(filter.getDateTo().plusDays(1)));
        }
        if (StringUtils.isNotBlank(filter.getTextSearch())) {
            where.append(" AND canonical_text ILIKE ?");
            params.add("%" + escapeLike(filter.getTextSearch().trim()) + "%");
        }
    }

    private Object startOfDay(LocalDate day) {
        return Timestamps.of(day.atStartOfDay(clock.getZone()).toInstant());
    }

    static String escapeLike(String text) {
        return text.replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    }

    /**
     * Sets the known flag and/or group of a canonical query.
     *
     * @throws TelemetryException of kind INVALID_CLASSIFICATION when the canonical query
     *         or the referenced group does not exist
     */
    public CanonicalQueryView setClassification(long canonicalQueryId, ClassificationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Classification body is required");
        }
        if (request.isClearGroup() && request.getGroupId() != null) {
            throw new IllegalArgumentException("groupId and clearGroup are mutually exclusive");
        }

        return dbSession.inTransaction(() -> {
            CanonicalQuery query = CanonicalQuery.findById(canonicalQueryId);
            if (query == null) {
                throw TelemetryException.invalidClassification("Canonical query " + canonicalQueryId + " does not exist");
            }
            if (request.getGroupId() != null && !QueryGroup.exists(request.getGroupId())) {
                throw TelemetryException.invalidClassification("Query group " + request.getGroupId() + " does not exist");
            }
            query.classify(request.getIsKnown(), request.getGroupId(), request.isClearGroup(), clock.instant());
            log.info("Classified canonical query {}: known={}, group={}",
                canonicalQueryId, query.isKnown(), query.getGroupId());
            return CanonicalQueryView.fromModel(query);
        });
    }

    public Optional<CanonicalQueryView> getCanonicalQuery(long canonicalQueryId) {
        return dbSession.withConnection(() -> {
            CanonicalQuery query = CanonicalQuery.findById(canonicalQueryId);
            return Optional.ofNullable(query).map(CanonicalQueryView::fromModel);
        });
    }

    /**
     * Raw-text variants of a canonical query, newest collection first.
     */
    public List<QuerySampleView> listSamples(long canonicalQueryId) {
        return dbSession.withConnection(() -> {
            List<QuerySampleView> samples = new ArrayList<>();
            for (QuerySample sample : QuerySample.findByCanonical(canonicalQueryId)) {
                samples.add(QuerySampleView.fromModel(sample));
            }
            return samples;
        });
    }

    /**
     * Statistics aggregated over the live samples of a canonical query; empty when
     * the canonical query does not exist.
     */
    public Optional<CanonicalQueryStats> getStats(long canonicalQueryId) {
        return dbSession.withConnection(() -> {
            if (CanonicalQuery.findById(canonicalQueryId) == null) {
                return Optional.<CanonicalQueryStats>empty();
            }
            List<Map> rows = Base.findAll(STATS_SQL, canonicalQueryId);
            Map<String, Object> row = rows.get(0);

            long totalCalls = ((Number) row.get("total_calls")).longValue();
            double totalTime = ((Number) row.get("total_time")).doubleValue();
            return Optional.of(CanonicalQueryStats.builder()
                .canonicalQueryId(canonicalQueryId)
                .sampleCount(((Number) row.get("sample_count")).longValue())
                .totalCalls(totalCalls)
                .totalTime(totalTime)
                .minTime(toDouble(row.get("min_time")))
                .maxTime(toDouble(row.get("max_time")))
                .avgTime(totalCalls > 0 ? totalTime / totalCalls : null)
                .firstCollectedAt(Timestamps.toInstant(row.get("first_collected_at")))
                .lastUpdatedAt(Timestamps.toInstant(row.get("last_updated_at")))
                .build());
        });
    }

    /**
     * Removes all telemetry of a target that no longer exists: its poll loop, sessions,
     * canonical queries and (by cascade) samples.
     *
     * @return number of canonical queries deleted
     */
    public int purgeTarget(long targetId) {
        monitoringScheduler.cancelIfRunning(targetId);
        return dbSession.inTransaction(() -> {
            int samples = Base.exec("DELETE FROM query_samples WHERE id_target = ?", targetId);
            int canonicals = Base.exec("DELETE FROM canonical_queries WHERE id_target = ?", targetId);
            int sessions = Base.exec("DELETE FROM monitoring_sessions WHERE id_target = ?", targetId);
            log.info("Purged target {}: {} canonical queries, {} samples, {} sessions",
                targetId, canonicals, samples, sessions);
            return canonicals;
        });
    }

    private static Double toDouble(Object value) {
        return value != null ? ((Number) value).doubleValue() : null;
    }
}
