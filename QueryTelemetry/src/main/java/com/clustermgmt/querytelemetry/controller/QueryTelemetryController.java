package com.clustermgmt.querytelemetry.controller;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryFilter;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryStats;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryView;
import com.clustermgmt.querytelemetry.dto.ClassificationRequest;
import com.clustermgmt.querytelemetry.dto.CycleReport;
import com.clustermgmt.querytelemetry.dto.DuplicateGroup;
import com.clustermgmt.querytelemetry.dto.MonitoringSessionView;
import com.clustermgmt.querytelemetry.dto.PruneReport;
import com.clustermgmt.querytelemetry.dto.QuerySampleView;
import com.clustermgmt.querytelemetry.dto.ReconciliationReport;
import com.clustermgmt.querytelemetry.dto.SchedulerStatus;
import com.clustermgmt.querytelemetry.dto.StartMonitoringRequest;
import com.clustermgmt.querytelemetry.service.CanonicalQueryService;
import com.clustermgmt.querytelemetry.service.CollectionCycleRunner;
import com.clustermgmt.querytelemetry.service.ConsistencyMaintainer;
import com.clustermgmt.querytelemetry.service.DuplicateReconciler;
import com.clustermgmt.querytelemetry.service.MonitoringScheduler;
import com.clustermgmt.querytelemetry.service.RetentionPruner;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST control surface of the query telemetry engine.
 */
@RestController
@RequestMapping("/api/query-telemetry")
@RequiredArgsConstructor
public class QueryTelemetryController {

    private final MonitoringScheduler monitoringScheduler;
    private final CollectionCycleRunner cycleRunner;
    private final CanonicalQueryService canonicalQueryService;
    private final DuplicateReconciler reconciler;
    private final RetentionPruner pruner;
    private final ConsistencyMaintainer consistencyMaintainer;
    private final TelemetryProperties props;

    // --- Monitoring sessions ---

    /**
     * Starts polling a target. Both body fields are optional.
     */
    @PostMapping("/targets/{targetId}/monitoring/start")
    public ResponseEntity<MonitoringSessionView> startMonitoring(
            @PathVariable long targetId,
            @RequestBody(required = false) StartMonitoringRequest request) {
        Integer interval = request != null ? request.getIntervalSeconds() : null;
        return ResponseEntity.ok(monitoringScheduler.startMonitoring(
            targetId, interval, request != null ? request.getScheduledEndTime() : null));
    }

    @PostMapping("/targets/{targetId}/monitoring/stop")
    public ResponseEntity<MonitoringSessionView> stopMonitoring(@PathVariable long targetId) {
        return ResponseEntity.ok(monitoringScheduler.stopMonitoring(targetId));
    }

    @GetMapping("/targets/{targetId}/monitoring/sessions")
    public ResponseEntity<List<MonitoringSessionView>> listSessions(@PathVariable long targetId) {
        return ResponseEntity.ok(monitoringScheduler.listSessions(targetId));
    }

    /**
     * Runs one collection cycle synchronously.
     */
    @PostMapping("/targets/{targetId}/collect")
    public ResponseEntity<CycleReport> collect(@PathVariable long targetId) {
        return ResponseEntity.ok(cycleRunner.runCycle(targetId));
    }

    // --- Canonical queries ---

    /**
     * Lists the canonical queries of a target, most recently seen first.
     *
     * @param dateFrom first day (inclusive) of lastSeenAt
     * @param dateTo   last day (inclusive) of lastSeenAt
     */
    @GetMapping("/targets/{targetId}/queries")
    public ResponseEntity<List<CanonicalQueryView>> listCanonicalQueries(
            @PathVariable long targetId,
            @RequestParam(defaultValue = "false") boolean knownOnly,
            @RequestParam(defaultValue = "false") boolean unknownOnly,
            @RequestParam(required = false) Long groupId,
            @RequestParam(defaultValue = "false") boolean ungroupedOnly,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) String textSearch) {
        CanonicalQueryFilter filter = CanonicalQueryFilter.builder()
            .targetId(targetId)
            .knownOnly(knownOnly)
            .unknownOnly(unknownOnly)
            .groupId(groupId)
            .ungroupedOnly(ungroupedOnly)
            .dateFrom(dateFrom)
            .dateTo(dateTo)
            .textSearch(textSearch)
            .build();
        return ResponseEntity.ok(canonicalQueryService.listCanonicalQueries(filter));
    }

    @GetMapping("/queries/{id}/samples")
    public ResponseEntity<List<QuerySampleView>> listSamples(@PathVariable long id) {
        return ResponseEntity.ok(canonicalQueryService.listSamples(id));
    }

    @GetMapping("/queries/{id}/stats")
    public ResponseEntity<CanonicalQueryStats> getStats(@PathVariable long id) {
        return canonicalQueryService.getStats(id)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @PatchMapping("/queries/{id}/classification")
    public ResponseEntity<CanonicalQueryView> setClassification(
            @PathVariable long id,
            @RequestBody ClassificationRequest request) {
        return ResponseEntity.ok(canonicalQueryService.setClassification(id, request));
    }

    // --- Maintenance ---

    @GetMapping("/targets/{targetId}/duplicates")
    public ResponseEntity<List<DuplicateGroup>> findDuplicates(@PathVariable long targetId) {
        return ResponseEntity.ok(reconciler.findDuplicateGroups(targetId));
    }

    @PostMapping("/targets/{targetId}/reconcile")
    public ResponseEntity<ReconciliationReport> reconcile(@PathVariable long targetId) {
        return ResponseEntity.ok(reconciler.reconcile(targetId));
    }

    /**
     * @param retentionSeconds horizon in seconds, telemetry.retention.days when omitted
     */
    @PostMapping("/targets/{targetId}/prune")
    public ResponseEntity<PruneReport> pruneTarget(
            @PathVariable long targetId,
            @RequestParam(required = false) Long retentionSeconds) {
        return ResponseEntity.ok(pruner.prune(targetId, horizon(retentionSeconds)));
    }

    @PostMapping("/maintenance/prune")
    public ResponseEntity<PruneReport> pruneAll(@RequestParam(required = false) Long retentionSeconds) {
        return ResponseEntity.ok(pruner.prune(horizon(retentionSeconds)));
    }

    @PostMapping("/targets/{targetId}/recount")
    public ResponseEntity<Map<String, Integer>> recount(@PathVariable long targetId) {
        return ResponseEntity.ok(Map.of("canonicalQueries", consistencyMaintainer.recomputeTarget(targetId)));
    }

    @DeleteMapping("/targets/{targetId}")
    public ResponseEntity<Void> purgeTarget(@PathVariable long targetId) {
        canonicalQueryService.purgeTarget(targetId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<SchedulerStatus> getSchedulerStatus() {
        return ResponseEntity.ok(monitoringScheduler.getStatus());
    }

    private Duration horizon(Long retentionSeconds) {
        if (retentionSeconds == null) {
            return props.getRetention().horizon();
        }
        if (retentionSeconds < 0) {
            throw new IllegalArgumentException("retentionSeconds must not be negative");
        }
        return Duration.ofSeconds(retentionSeconds);
    }
}
