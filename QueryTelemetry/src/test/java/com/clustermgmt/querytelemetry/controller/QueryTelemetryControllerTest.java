package com.clustermgmt.querytelemetry.controller;

import com.clustermgmt.querytelemetry.config.TelemetryProperties;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryFilter;
import com.clustermgmt.querytelemetry.dto.CanonicalQueryView;
import com.clustermgmt.querytelemetry.dto.ClassificationRequest;
import com.clustermgmt.querytelemetry.dto.MonitoringSessionView;
import com.clustermgmt.querytelemetry.dto.PruneReport;
import com.clustermgmt.querytelemetry.exception.TelemetryException;
import com.clustermgmt.querytelemetry.service.CanonicalQueryService;
import com.clustermgmt.querytelemetry.service.CollectionCycleRunner;
import com.clustermgmt.querytelemetry.service.ConsistencyMaintainer;
import com.clustermgmt.querytelemetry.service.DuplicateReconciler;
import com.clustermgmt.querytelemetry.service.MonitoringScheduler;
import com.clustermgmt.querytelemetry.service.RetentionPruner;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueryTelemetryController.class)
class QueryTelemetryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MonitoringScheduler monitoringScheduler;

    @MockBean
    private CollectionCycleRunner cycleRunner;

    @MockBean
    private CanonicalQueryService canonicalQueryService;

    @MockBean
    private DuplicateReconciler reconciler;

    @MockBean
    private RetentionPruner pruner;

    @MockBean
    private ConsistencyMaintainer consistencyMaintainer;

    @MockBean
    private TelemetryProperties props;

    @Test
    void startReturnsTheNewSession() throws Exception {
        when(monitoringScheduler.startMonitoring(5L, 60, null)).thenReturn(MonitoringSessionView.builder()
            .id(1L).targetId(5L).intervalSeconds(60).status("running")
            .startedAt(Instant.parse("2026-03-01T10:00:00Z"))
            .build());

        mockMvc.perform(post("/api/query-telemetry/targets/5/monitoring/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intervalSeconds\": 60}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.startedAt").value("2026-03-01T10:00:00Z"));
    }

    @Test
    void startWithoutBodyUsesDefaults() throws Exception {
        when(monitoringScheduler.startMonitoring(5L, null, null))
            .thenReturn(MonitoringSessionView.builder().id(1L).status("running").build());

        mockMvc.perform(post("/api/query-telemetry/targets/5/monitoring/start"))
            .andExpect(status().isOk());
    }

    @Test
    void sessionConflictIsReportedWithItsKind() throws Exception {
        when(monitoringScheduler.startMonitoring(eq(5L), any(), any()))
            .thenThrow(TelemetryException.sessionConflict("Monitoring is already running for target 5"));

        mockMvc.perform(post("/api/query-telemetry/targets/5/monitoring/start")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"intervalSeconds\": 60}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.kind").value("SESSION_STATE_CONFLICT"))
            .andExpect(jsonPath("$.message").value("Monitoring is already running for target 5"));
    }

    @Test
    void listingPassesEveryFilter() throws Exception {
        when(canonicalQueryService.listCanonicalQueries(any())).thenReturn(List.of(
            CanonicalQueryView.builder().id(3L).canonicalText("SELECT $?").build()));

        mockMvc.perform(get("/api/query-telemetry/targets/5/queries")
                .param("unknownOnly", "true")
                .param("groupId", "9")
                .param("dateFrom", "2026-03-01")
                .param("dateTo", "2026-03-02")
                .param("textSearch", "orders"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value(3))
            .andExpect(jsonPath("$[0].canonicalText").value("SELECT $?"));

        ArgumentCaptor<CanonicalQueryFilter> filter = ArgumentCaptor.forClass(CanonicalQueryFilter.class);
        verify(canonicalQueryService).listCanonicalQueries(filter.capture());
        assertThat(filter.getValue().getTargetId()).isEqualTo(5L);
        assertThat(filter.getValue().isUnknownOnly()).isTrue();
        assertThat(filter.getValue().isKnownOnly()).isFalse();
        assertThat(filter.getValue().getGroupId()).isEqualTo(9L);
        assertThat(filter.getValue().getDateFrom()).isEqualTo(LocalDate.of(2026, 3, 1));
        assertThat(filter.getValue().getDateTo()).isEqualTo(LocalDate.of(2026, 3, 2));
        assertThat(filter.getValue().getTextSearch()).isEqualTo("orders");
    }

    @Test
    void badFilterCombinationIsABadRequest() throws Exception {
        when(canonicalQueryService.listCanonicalQueries(any()))
            .thenThrow(new IllegalArgumentException("knownOnly and unknownOnly are mutually exclusive"));

        mockMvc.perform(get("/api/query-telemetry/targets/5/queries")
                .param("knownOnly", "true")
                .param("unknownOnly", "true"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("INVALID_REQUEST"));
    }

    @Test
    void classificationBodyIsBound() throws Exception {
        when(canonicalQueryService.setClassification(eq(3L), any()))
            .thenReturn(CanonicalQueryView.builder().id(3L).known(true).groupId(9L).build());

        mockMvc.perform(patch("/api/query-telemetry/queries/3/classification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"isKnown\": true, \"groupId\": 9}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.known").value(true));

        ArgumentCaptor<ClassificationRequest> request = ArgumentCaptor.forClass(ClassificationRequest.class);
        verify(canonicalQueryService).setClassification(eq(3L), request.capture());
        assertThat(request.getValue().getIsKnown()).isTrue();
        assertThat(request.getValue().getGroupId()).isEqualTo(9L);
        assertThat(request.getValue().isClearGroup()).isFalse();
    }

    @Test
    void invalidClassificationIsNotFound() throws Exception {
        when(canonicalQueryService.setClassification(eq(404L), any()))
            .thenThrow(TelemetryException.invalidClassification("Canonical query 404 does not exist"));

        mockMvc.perform(patch("/api/query-telemetry/queries/404/classification")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"isKnown\": true}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("INVALID_CLASSIFICATION"));
    }

    @Test
    void statsOfUnknownCanonicalIsNotFound() throws Exception {
        when(canonicalQueryService.getStats(anyLong())).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/query-telemetry/queries/77/stats"))
            .andExpect(status().isNotFound());
    }

    @Test
    void pruneDefaultsToConfiguredRetention() throws Exception {
        when(props.getRetention()).thenReturn(new TelemetryProperties.Retention());
        when(pruner.prune(7L, Duration.ofDays(90))).thenReturn(PruneReport.builder().deletedSamples(4).build());

        mockMvc.perform(post("/api/query-telemetry/targets/7/prune"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deletedSamples").value(4));
    }

    @Test
    void pruneAcceptsExplicitHorizon() throws Exception {
        when(pruner.prune(Duration.ZERO)).thenReturn(PruneReport.builder().deletedSamples(2).build());

        mockMvc.perform(post("/api/query-telemetry/maintenance/prune").param("retentionSeconds", "0"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deletedSamples").value(2));
    }

    @Test
    void negativeHorizonIsABadRequest() throws Exception {
        mockMvc.perform(post("/api/query-telemetry/targets/7/prune").param("retentionSeconds", "-5"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void purgeAnswersNoContent() throws Exception {
        mockMvc.perform(delete("/api/query-telemetry/targets/7"))
            .andExpect(status().isNoContent());

        verify(canonicalQueryService).purgeTarget(7L);
    }

    @Test
    void recountReportsRewrittenRows() throws Exception {
        when(consistencyMaintainer.recomputeTarget(7L)).thenReturn(3);

        mockMvc.perform(post("/api/query-telemetry/targets/7/recount"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.canonicalQueries").value(3));
    }
}
