package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.db.DbSession;
import com.clustermgmt.querytelemetry.dto.MaintenanceSummary;
import com.clustermgmt.querytelemetry.dto.PruneReport;
import com.clustermgmt.querytelemetry.dto.ReconciliationReport;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.javalite.activejdbc.Base;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic out-of-band maintenance: optional duplicate reconciliation followed by
 * retention pruning, target by target.
 */
@Service
@Slf4j
public class MaintenanceJob {

    private final DuplicateReconciler reconciler;
    private final RetentionPruner pruner;
    private final DbSession dbSession;
    private final TelemetryProperties props;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "telemetry-maintenance");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicBoolean running = new AtomicBoolean(false);

    public MaintenanceJob(DuplicateReconciler reconciler,
                          RetentionPruner pruner,
                          DbSession dbSession,
                          TelemetryProperties props) {
        this.reconciler = reconciler;
        this.pruner = pruner;
        this.dbSession = dbSession;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        TelemetryProperties.Maintenance maintenance = props.getMaintenance();
        if (!maintenance.isEnabled()) {
            log.info("Scheduled maintenance disabled");
            return;
        }
        running.set(true);
        scheduler.scheduleWithFixedDelay(
            this::runScheduled,
            maintenance.getIntervalMinutes(),
            maintenance.getIntervalMinutes(),
            TimeUnit.MINUTES
        );
        log.info("Scheduled maintenance every {} minutes (retention {} days, reconcile {})",
            maintenance.getIntervalMinutes(), props.getRetention().getDays(), maintenance.isReconcile());
    }

    @PreDestroy
    public void stop() {
        running.set(false);
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void runScheduled() {
        if (!running.get()) {
            return;
        }
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Maintenance run failed: {}", e.getMessage(), e);
        }
    }

    /**
     * One maintenance pass over every target holding telemetry. A failing target is
     * logged and skipped.
     */
    public MaintenanceSummary runOnce() {
        boolean reconcile = props.getMaintenance().isReconcile();
        Duration horizon = props.getRetention().horizon();
        List<Long> targets = dbSession.withConnection(() -> RetentionPruner.toLongs(
            Base.firstColumn("SELECT DISTINCT id_target FROM canonical_queries ORDER BY id_target")));

        MaintenanceSummary summary = new MaintenanceSummary();
        for (Long targetId : targets) {
            try {
                if (reconcile) {
                    ReconciliationReport report = reconciler.reconcile(targetId);
                    summary.setGroupsMerged(summary.getGroupsMerged() + report.getGroupsMerged());
                }
                PruneReport pruned = pruner.prune(targetId, horizon);
                summary.setSamplesDeleted(summary.getSamplesDeleted() + pruned.getDeletedSamples());
                summary.setChildlessCanonicals(summary.getChildlessCanonicals() + pruned.getChildlessCanonicals());
                summary.setTargets(summary.getTargets() + 1);
            } catch (RuntimeException e) {
                summary.setFailedTargets(summary.getFailedTargets() + 1);
                log.warn("Maintenance of target {} failed: {}", targetId, e.getMessage());
            }
        }

        log.info("Maintenance done: {} targets, {} duplicate groups merged, {} samples pruned, " +
                "{} canonical queries kept without samples, {} targets failed",
            summary.getTargets(), summary.getGroupsMerged(), summary.getSamplesDeleted(),
            summary.getChildlessCanonicals(), summary.getFailedTargets());
        return summary;
    }
}
