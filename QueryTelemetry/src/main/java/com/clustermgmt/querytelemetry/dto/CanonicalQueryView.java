package com.clustermgmt.querytelemetry.dto;

import com.clustermgmt.querytelemetry.model.CanonicalQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalQueryView {

    private long id;
    private long targetId;
    private String canonicalText;
    private String canonicalFingerprint;
    private Instant firstSeenAt;
    private Instant lastSeenAt;
    private boolean known;
    private Long groupId;
    private int distinctVariantCount;
    private int instanceCount;
    private Instant updatedAt;

    public static CanonicalQueryView fromModel(CanonicalQuery model) {
        return CanonicalQueryView.builder()
            .id(model.getLongId())
            .targetId(model.getTargetId())
            .canonicalText(model.getCanonicalText())
            .canonicalFingerprint(model.getFingerprint())
            .firstSeenAt(model.getFirstSeenAt())
            .lastSeenAt(model.getLastSeenAt())
            .known(model.isKnown())
            .groupId(model.getGroupId())
            .distinctVariantCount(model.getDistinctVariantCount())
            .instanceCount(model.getInstanceCount())
            .updatedAt(model.getUpdatedAt())
            .build();
    }
}
