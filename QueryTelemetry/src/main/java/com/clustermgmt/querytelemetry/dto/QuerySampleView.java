package com.clustermgmt.querytelemetry.dto;

import com.clustermgmt.querytelemetry.model.QuerySample;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuerySampleView {

    private long id;
    private long canonicalQueryId;
    private String rawText;
    private String rawFingerprint;
    private long calls;
    private double totalTime;
    private Double minTime;
    private Double maxTime;
    private Double meanTime;
    private Instant collectedAt;
    private Instant lastUpdatedAt;

    public static QuerySampleView fromModel(QuerySample model) {
        return QuerySampleView.builder()
            .id(model.getLongId())
            .canonicalQueryId(model.getCanonicalQueryId())
            .rawText(model.getRawText())
            .rawFingerprint(model.getRawFingerprint())
            .calls(model.getCalls())
            .totalTime(model.getTotalTime())
            .minTime(model.getMinTime())
            .maxTime(model.getMaxTime())
            .meanTime(model.getMeanTime())
            .collectedAt(model.getCollectedAt())
            .lastUpdatedAt(model.getLastUpdatedAt())
            .build();
    }
}
