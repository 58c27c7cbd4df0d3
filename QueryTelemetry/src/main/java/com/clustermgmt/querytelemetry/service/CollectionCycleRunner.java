package com.clustermgmt.querytelemetry.service;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.dto.CycleReport;
import com.clustermgmt.querytelemetry.dto.IngestResult;
import com.clustermgmt.querytelemetry.exception.ErrorKind;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.clustermgmt.querytelemetry.source.SnapshotRow;
import com.clustermgmt.querytelemetry.source.TelemetrySource;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One collection cycle: fetch a snapshot of a target, then ingest every row.
 *
 * Shared by the poll loops and the manual collect endpoint. A cycle never throws for
 * an unavailable source or a failing row; both are counted in the returned report.
 */
@Service
@Slf4j
public class CollectionCycleRunner {

    private final TelemetrySource telemetrySource;
    private final SampleStore sampleStore;
    private final TelemetryProperties props;
    private final Clock clock;

    private final AtomicInteger fetchThreadCounter = new AtomicInteger();
    private final ExecutorService fetchExecutor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "telemetry-fetch-" + fetchThreadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public CollectionCycleRunner(TelemetrySource telemetrySource,
                                 SampleStore sampleStore,
                                 TelemetryProperties props,
                                 Clock clock) {
        this.telemetrySource = telemetrySource;
        this.sampleStore = sampleStore;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Manual cycle, bounded by the configured source timeout.
     */
    public CycleReport runCycle(long targetId) {
        return runCycle(targetId, Duration.ofMillis(props.getSource().getTimeoutMs()));
    }

    public CycleReport runCycle(long targetId, Duration sourceTimeout) {
        CycleReport report = CycleReport.builder()
            .targetId(targetId)
            .startedAt(clock.instant())
            .build();

        List<SnapshotRow> rows;
        try {
            rows = fetchSnapshot(targetId, sourceTimeout);
        } catch (TelemetryException e) {
            log.warn("[{}] {}", e.getKind(), e.getMessage());
            report.setSourceAvailable(false);
            report.setSourceError(e.getMessage());
            report.setFinishedAt(clock.instant());
            return report;
        }

        report.setSourceAvailable(true);
        report.setRowsFetched(rows.size());
        for (SnapshotRow row : rows) {
            try {
                IngestResult result = sampleStore.ingest(targetId, row.rawText(), row.statistics());
                report.setRowsIngested(report.getRowsIngested() + 1);
                if (result.newCanonical()) {
                    report.setNewCanonicals(report.getNewCanonicals() + 1);
                }
                if (result.newSample()) {
                    report.setNewSamples(report.getNewSamples() + 1);
                }
            } catch (RuntimeException e) {
                // left for the next cycle, the source reports the row again
                report.setRowsFailed(report.getRowsFailed() + 1);
                log.warn("[{}] Row skipped on target {}: {}", ErrorKind.STORE_WRITE_FAILURE, targetId, e.getMessage());
            }
        }
        report.setFinishedAt(clock.instant());

        log.debug("Cycle on target {}: {} rows fetched, {} ingested, {} failed, {} new canonical queries",
            targetId, report.getRowsFetched(), report.getRowsIngested(), report.getRowsFailed(),
            report.getNewCanonicals());
        return report;
    }

    private List<SnapshotRow> fetchSnapshot(long targetId, Duration timeout) {
        Future<List<SnapshotRow>> future = fetchExecutor.submit(() -> telemetrySource.fetchSnapshot(targetId));
        try {
            List<SnapshotRow> rows = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return rows != null ? rows : List.of();
        } catch (TimeoutException e) {
            future.cancel(true);
            throw TelemetryException.sourceUnavailable(targetId, "no snapshot within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TelemetryException te && te.getKind() == ErrorKind.SOURCE_UNAVAILABLE) {
                throw te;
            }
            throw TelemetryException.sourceUnavailable(targetId, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw TelemetryException.sourceUnavailable(targetId, "interrupted", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        fetchExecutor.shutdownNow();
    }
}
