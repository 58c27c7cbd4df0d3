package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * DTO returned by GET /scheduler/status.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerStatus {

    private int poolSize;
    private int activePolls;
    private List<PollInfo> polls;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PollInfo {
        private long targetId;
        private long sessionId;
        private int intervalSeconds;
        private Instant scheduledEndTime;
        private CycleReport lastCycle;
    }
}
