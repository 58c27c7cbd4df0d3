package com.clustermgmt.querytelemetry.model;

import com.clustermgmt.querytelemetry.util.Timestamps;
import org.javalite.activejdbc.Base;
import org.javalite.activejdbc.Model;
import org.javalite.activejdbc.annotations.IdName;
import org.javalite.activejdbc.annotations.Table;

import java.time.Instant;
import java.util.List;

/**
 * ActiveJDBC model for the monitoring_sessions table.
 * Polling lifecycle of one target; at most one row per target is RUNNING.
 */
@Table("monitoring_sessions")
@IdName("id_session")
public class MonitoringSession extends Model {

    static {
        validatePresenceOf(
            "id_target",
            "interval_seconds",
            "status",
            "started_at"
        );
    }

    /**
     * Possible values of status.
     */
    public static class Status {
        public static final String RUNNING = "running";
        public static final String STOPPED = "stopped";
        public static final String COMPLETED = "completed";
    }

    public static MonitoringSession createRunning(long targetId, int intervalSeconds,
                                                  Instant scheduledEndTime, Instant now) {
        MonitoringSession session = new MonitoringSession();
        session.set("id_target", targetId);
        session.set("interval_seconds", intervalSeconds);
        session.set("scheduled_end_time", Timestamps.of(scheduledEndTime));
        session.set("status", Status.RUNNING);
        session.set("started_at", Timestamps.of(now));
        session.saveIt();
        return session;
    }

    public static MonitoringSession findRunning(long targetId) {
        return MonitoringSession.findFirst(
            "id_target = ? AND status = ?",
            targetId, Status.RUNNING
        );
    }

    public static List<MonitoringSession> findAllRunning() {
        return MonitoringSession.where("status = ?", Status.RUNNING).orderBy("id_session");
    }

    public static MonitoringSession findLatest(long targetId) {
        List<MonitoringSession> sessions = MonitoringSession.where("id_target = ?", targetId)
            .orderBy("started_at DESC, id_session DESC")
            .limit(1);
        return sessions.isEmpty() ? null : sessions.get(0);
    }

    public static List<MonitoringSession> findByTarget(long targetId) {
        return MonitoringSession.where("id_target = ?", targetId)
            .orderBy("started_at DESC, id_session DESC");
    }

    /**
     * Records a finished cycle. Guarded on status so that a cycle finishing after
     * stop cannot touch a closed session.
     */
    public static int touchLastRun(long sessionId, Instant now) {
        return Base.exec(
            "UPDATE monitoring_sessions SET last_run_at = ? WHERE id_session = ? AND status = ?",
            Timestamps.of(now), sessionId, Status.RUNNING
        );
    }

    /**
     * Moves a running session to a terminal status; returns 0 when it was no longer running.
     */
    public static int close(long sessionId, String status, Instant now) {
        return Base.exec(
            "UPDATE monitoring_sessions SET status = ?, stopped_at = ? WHERE id_session = ? AND status = ?",
            status, Timestamps.of(now), sessionId, Status.RUNNING
        );
    }

    public long getTargetId() {
        return getLong("id_target");
    }

    public int getIntervalSeconds() {
        return getInteger("interval_seconds");
    }

    public String getStatus() {
        return getString("status");
    }

    public Instant getScheduledEndTime() {
        return Timestamps.toInstant(get("scheduled_end_time"));
    }

    public Instant getStartedAt() {
        return Timestamps.toInstant(get("started_at"));
    }

    public Instant getStoppedAt() {
        return Timestamps.toInstant(get("stopped_at"));
    }

    public Instant getLastRunAt() {
        return Timestamps.toInstant(get("last_run_at"));
    }
}
