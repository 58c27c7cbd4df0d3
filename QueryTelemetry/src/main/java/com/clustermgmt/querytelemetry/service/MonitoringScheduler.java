package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.dto.CycleReport;
import com.clustermgmt.querytelemetry.dto.MonitoringSessionView;
import com.clustermgmt.querytelemetry.dto.SchedulerStatus;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.clustermgmt.querytelemetry.model.MonitoringSession;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one poll loop per monitored target.
 *
 * Loops are registered in a map keyed by target id; starting, stopping and resuming
 * are serialized by a lock, status reads are lock-free. Cycles of one loop never
 * overlap (fixed delay scheduling) and loops of different targets run in parallel on
 * a shared pool. The monitoring_sessions row is the durable side of each loop.
 */
@Service
@Slf4j
public class MonitoringScheduler {

    private final CollectionCycleRunner cycleRunner;
    private final DbSession dbSession;
    private final TelemetryProperties props;
    private final Clock clock;

    private final ScheduledExecutorService executor;
    private final ConcurrentHashMap<Long, ScheduledPoll> polls = new ConcurrentHashMap<>();
    private final ReentrantLock lifecycleLock = new ReentrantLock();

    public MonitoringScheduler(CollectionCycleRunner cycleRunner,
                               DbSession dbSession,
                               TelemetryProperties props,
                               Clock clock) {
        this.cycleRunner = cycleRunner;
        this.dbSession = dbSession;
        this.props = props;
        this.clock = clock;

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(props.getScheduler().getPoolSize(), runnable -> {
            Thread thread = new Thread(runnable, "telemetry-poll-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (props.getScheduler().isResumeOnStartup()) {
            resumeRunningSessions();
        }
    }

    /**
     * Loops are abandoned, not stopped: their sessions stay running so the next
     * process can resume them.
     */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down MonitoringScheduler ({} active polls)...", polls.size());
        lifecycleLock.lock();
        try {
            polls.values().forEach(ScheduledPoll::cancel);
            polls.clear();
        } finally {
            lifecycleLock.unlock();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Creates a running session and starts its poll loop. The first cycle runs immediately.
     *
     * @param intervalSeconds  seconds between cycles, the configured default when null
     * @param scheduledEndTime optional instant after which the session completes
     * @throws TelemetryException of kind SESSION_STATE_CONFLICT when the target is already monitored
     */
    public MonitoringSessionView startMonitoring(long targetId, Integer intervalSeconds, Instant scheduledEndTime) {
        int interval = intervalSeconds != null ? intervalSeconds : props.getScheduler().getDefaultIntervalSeconds();
        if (interval <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be positive, got " + interval);
        }
        if (scheduledEndTime != null && !scheduledEndTime.isAfter(clock.instant())) {
            throw new IllegalArgumentException("scheduledEndTime " + scheduledEndTime + " is not in the future");
        }

        lifecycleLock.lock();
        try {
            if (polls.containsKey(targetId)) {
                throw TelemetryException.sessionConflict("Monitoring is already running for target " + targetId);
            }

            MonitoringSessionView session = dbSession.inTransaction(() -> {
                if (MonitoringSession.findRunning(targetId) != null) {
                    throw TelemetryException.sessionConflict("Monitoring is already running for target " + targetId);
                }
                return MonitoringSessionView.fromModel(
                    MonitoringSession.createRunning(targetId, interval, scheduledEndTime, clock.instant()));
            });

            ScheduledPoll poll = new ScheduledPoll(targetId, session.getId(), interval, scheduledEndTime);
            try {
                schedule(poll, 0);
            } catch (RejectedExecutionException e) {
                dbSession.withConnection(() -> MonitoringSession.close(poll.sessionId, MonitoringSession.Status.STOPPED, clock.instant()));
                throw TelemetryException.sessionConflict("Scheduler is shutting down, cannot monitor target " + targetId);
            }

            log.info("Started monitoring of target {} every {}s (session {}, ends {})",
                targetId, interval, session.getId(), scheduledEndTime != null ? scheduledEndTime : "never");
            return session;
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Stops the loop of a target and marks its session stopped. Stopping an already
     * stopped or completed target returns its latest session unchanged.
     *
     * @throws TelemetryException of kind SESSION_STATE_CONFLICT when the target was never monitored
     */
    public MonitoringSessionView stopMonitoring(long targetId) {
        lifecycleLock.lock();
        try {
            ScheduledPoll poll = polls.remove(targetId);
            if (poll != null) {
                poll.cancel();
            }

            return dbSession.inTransaction(() -> {
                MonitoringSession running = MonitoringSession.findRunning(targetId);
                if (running != null) {
                    MonitoringSession.close(running.getLongId(), MonitoringSession.Status.STOPPED, clock.instant());
                    running.refresh();
                    log.info("Stopped monitoring of target {} (session {})", targetId, running.getLongId());
                    return MonitoringSessionView.fromModel(running);
                }
                MonitoringSession latest = MonitoringSession.findLatest(targetId);
                if (latest == null) {
                    throw TelemetryException.sessionConflict("Monitoring was never started for target " + targetId);
                }
                log.debug("Monitoring of target {} already {}", targetId, latest.getStatus());
                return MonitoringSessionView.fromModel(latest);
            });
        } finally {
            lifecycleLock.unlock();
        }
    }

    public List<MonitoringSessionView> listSessions(long targetId) {
        return dbSession.withConnection(() -> {
            List<MonitoringSessionView> sessions = new ArrayList<>();
            for (MonitoringSession session : MonitoringSession.findByTarget(targetId)) {
                sessions.add(MonitoringSessionView.fromModel(session));
            }
            return sessions;
        });
    }

    /**
     * Re-attaches a loop to every session a previous process left running. The first
     * cycle waits for what remains of the interval since the last run.
     *
     * @return number of loops resumed
     */
    public int resumeRunningSessions() {
        lifecycleLock.lock();
        try {
            Instant now = clock.instant();
            List<ScheduledPoll> toResume = new ArrayList<>();
            List<Long> delays = new ArrayList<>();

            dbSession.withConnection(() -> {
                for (MonitoringSession session : MonitoringSession.findAllRunning()) {
                    long targetId = session.getTargetId();
                    if (polls.containsKey(targetId)) {
                        continue;
                    }
                    Instant endTime = session.getScheduledEndTime();
                    if (endTime != null && !endTime.isAfter(now)) {
                        MonitoringSession.close(session.getLongId(), MonitoringSession.Status.COMPLETED, now);
                        log.info("Session {} of target {} ended while the service was down", session.getLongId(), targetId);
                        continue;
                    }
                    toResume.add(new ScheduledPoll(targetId, session.getLongId(), session.getIntervalSeconds(), endTime));
                    delays.add(initialDelay(session, now));
                }
            });

            for (int i = 0; i < toResume.size(); i++) {
                ScheduledPoll poll = toResume.get(i);
                schedule(poll, delays.get(i));
                log.info("Resumed monitoring of target {} (session {}), first cycle in {}s",
                    poll.targetId, poll.sessionId, delays.get(i));
            }
            return toResume.size();
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Cancels the loop of a target without touching its session; used before the
     * target's data is deleted.
     */
    public void cancelIfRunning(long targetId) {
        lifecycleLock.lock();
        try {
            ScheduledPoll poll = polls.remove(targetId);
            if (poll != null) {
                poll.cancel();
                log.info("Cancelled poll loop of target {}", targetId);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isPolling(long targetId) {
        return polls.containsKey(targetId);
    }

    /**
     * Returns current status (lock-free read from ConcurrentHashMap).
     */
    public SchedulerStatus getStatus() {
        List<SchedulerStatus.PollInfo> infos = new ArrayList<>();
        for (Map.Entry<Long, ScheduledPoll> entry : polls.entrySet()) {
            ScheduledPoll poll = entry.getValue();
            infos.add(SchedulerStatus.PollInfo.builder()
                .targetId(entry.getKey())
                .sessionId(poll.sessionId)
                .intervalSeconds(poll.intervalSeconds)
                .scheduledEndTime(poll.scheduledEndTime)
                .lastCycle(poll.lastCycle)
                .build());
        }
        return SchedulerStatus.builder()
            .poolSize(props.getScheduler().getPoolSize())
            .activePolls(infos.size())
            .polls(infos)
            .build();
    }

    private void schedule(ScheduledPoll poll, long initialDelaySeconds) {
        polls.put(poll.targetId, poll);
        try {
            poll.attach(executor.scheduleWithFixedDelay(
                () -> tick(poll),
                initialDelaySeconds,
                poll.intervalSeconds,
                TimeUnit.SECONDS
            ));
        } catch (RejectedExecutionException e) {
            polls.remove(poll.targetId, poll);
            throw e;
        }
    }

    private void tick(ScheduledPoll poll) {
        try {
            CycleReport report;
            poll.cycleGuard.lock();
            try {
                if (poll.cancelled) {
                    return;
                }
                if (endTimeReached(poll)) {
                    complete(poll);
                    return;
                }

                Duration timeout = props.getSource().timeoutFor(poll.intervalSeconds);
                report = cycleRunner.runCycle(poll.targetId, timeout);
            } finally {
                poll.cycleGuard.unlock();
            }
            poll.lastCycle = report;

            if (!poll.cancelled) {
                int touched = dbSession.withConnection(() -> MonitoringSession.touchLastRun(poll.sessionId, clock.instant()));
                if (touched == 0) {
                    // closed behind our back (another process, or a manual update)
                    log.warn("Session {} of target {} is no longer running, dropping its poll loop",
                        poll.sessionId, poll.targetId);
                    poll.cancel();
                    polls.remove(poll.targetId, poll);
                    return;
                }
            }

            if (endTimeReached(poll)) {
                complete(poll);
            }
        } catch (RuntimeException e) {
            log.error("Poll cycle of target {} failed, retrying in {}s: {}",
                poll.targetId, poll.intervalSeconds, e.getMessage(), e);
        }
    }

    private boolean endTimeReached(ScheduledPoll poll) {
        return poll.scheduledEndTime != null && !clock.instant().isBefore(poll.scheduledEndTime);
    }

    private void complete(ScheduledPoll poll) {
        poll.cancel();
        polls.remove(poll.targetId, poll);
        int closed = dbSession.withConnection(() ->
            MonitoringSession.close(poll.sessionId, MonitoringSession.Status.COMPLETED, clock.instant()));
        if (closed > 0) {
            log.info("Monitoring of target {} completed at its scheduled end time (session {})",
                poll.targetId, poll.sessionId);
        }
    }

    private static long initialDelay(MonitoringSession session, Instant now) {
        Instant lastRun = session.getLastRunAt();
        if (lastRun == null) {
            return 0;
        }
        long elapsed = Duration.between(lastRun, now).getSeconds();
        return Math.max(0, session.getIntervalSeconds() - elapsed);
    }

    /**
     * A registered poll loop.
     */
    private static final class ScheduledPoll {
        private final long targetId;
        private final long sessionId;
        private final int intervalSeconds;
        private final Instant scheduledEndTime;

        // held while a cycle is admitted and running
        private final ReentrantLock cycleGuard = new ReentrantLock();

        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;
        private volatile CycleReport lastCycle;

        private ScheduledPoll(long targetId, long sessionId, int intervalSeconds, Instant scheduledEndTime) {
            this.targetId = targetId;
            this.sessionId = sessionId;
            this.intervalSeconds = intervalSeconds;
            this.scheduledEndTime = scheduledEndTime;
        }

        private void attach(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled) {
                scheduled.cancel(false);
            }
        }

        /**
         * Marks the loop cancelled and waits for an in-flight cycle, so no cycle of this
         * loop runs once cancel returns.
         */
        private void cancel() {
            cancelled = true;
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            cycleGuard.lock();
            cycleGuard.unlock();
        }
    }
}
