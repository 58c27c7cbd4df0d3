package com.clustermgmt.querytelemetry.source;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.DB;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Telemetry source reading the pg_stat_statements view of a PostgreSQL target.
 */
@Component
@Slf4j
public class PgStatStatementsSource implements TelemetrySource {

    static final String EXTENSION_CHECK_SQL =
        "SELECT COUNT(*) FROM pg_extension WHERE extname = 'pg_stat_statements'";

    static final String SNAPSHOT_SQL =
        "SELECT query, calls, total_exec_time, min_exec_time, max_exec_time, mean_exec_time " +
        "FROM pg_stat_statements " +
        "WHERE query NOT LIKE '%pg_stat_statements%' " +
        "ORDER BY total_exec_time DESC " +
        "LIMIT ?";

    private final TargetDataSourceRegistry dataSources;
    private final TelemetryProperties props;

    public PgStatStatementsSource(TargetDataSourceRegistry dataSources, TelemetryProperties props) {
        this.dataSources = dataSources;
        this.props = props;
    }

    @Override
    public List<SnapshotRow> fetchSnapshot(long targetId) {
        // Named DB so the target connection never shadows the store connection of this thread
        DB db = new DB("target-" + targetId);
        try {
            db.open(dataSources.get(targetId));
            Object installed = db.firstCell(EXTENSION_CHECK_SQL);
            if (installed == null || ((Number) installed).longValue() == 0) {
                throw TelemetryException.sourceUnavailable(targetId, "pg_stat_statements extension is not installed", null);
            }

            List<Map> rows = db.findAll(SNAPSHOT_SQL, props.getSource().getMaxRows());
            List<SnapshotRow> snapshot = new ArrayList<>(rows.size());
            for (Map<String, Object> row : rows) {
                snapshot.add(toSnapshotRow(row));
            }
            log.debug("Fetched {} statement rows from target {}", snapshot.size(), targetId);
            return snapshot;
        } catch (TelemetryException e) {
            throw e;
        } catch (RuntimeException e) {
            // connection and SQL failures alike: ActiveJDBC wraps them unchecked
            throw TelemetryException.sourceUnavailable(targetId, e.getMessage(), e);
        } finally {
            if (db.hasConnection()) {
                db.close();
            }
        }
    }

    static SnapshotRow toSnapshotRow(Map<String, Object> row) {
        Double totalTime = toDouble(row.get("total_exec_time"));
        QueryStatistics statistics = new QueryStatistics(
            toLong(row.get("calls")),
            totalTime != null ? totalTime : 0d,
            toDouble(row.get("min_exec_time")),
            toDouble(row.get("max_exec_time")),
            toDouble(row.get("mean_exec_time"))
        );
        return new SnapshotRow((String) row.get("query"), statistics);
    }

    private static long toLong(Object value) {
        return value != null ? ((Number) value).longValue() : 0L;
    }

    private static Double toDouble(Object value) {
        return value != null ? ((Number) value).doubleValue() : null;
    }
}
