package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PruneReport {

    private Instant cutoff;
    private int deletedSamples;
    private int affectedCanonicals;

    /** Canonical rows without any sample left; kept on purpose. */
    private long childlessCanonicals;
}
