package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationReport {

    private long targetId;
    private int groupsFound;
    private int groupsMerged;
    private int rowsDeleted;
    private int samplesMoved;

    @Builder.Default
    private List<String> failures = new ArrayList<>();
}
