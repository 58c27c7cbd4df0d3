package com.clustermgmt.querytelemetry.dto;

import com.clustermgmt.querytelemetry.model.MonitoringSession;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoringSessionView {

    private long id;
    private long targetId;
    private int intervalSeconds;
    private Instant scheduledEndTime;
    private String status;
    private Instant startedAt;
    private Instant stoppedAt;
    private Instant lastRunAt;

    public static MonitoringSessionView fromModel(MonitoringSession model) {
        return MonitoringSessionView.builder()
            .id(model.getLongId())
            .targetId(model.getTargetId())
            .intervalSeconds(model.getIntervalSeconds())
            .scheduledEndTime(model.getScheduledEndTime())
            .status(model.getStatus())
            .startedAt(model.getStartedAt())
            .stoppedAt(model.getStoppedAt())
            .lastRunAt(model.getLastRunAt())
            .build();
    }
}
