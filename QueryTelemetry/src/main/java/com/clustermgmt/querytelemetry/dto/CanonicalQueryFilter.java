package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Filters of the canonical query listing. Unset fields do not restrict.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalQueryFilter {

    private long targetId;
    private boolean knownOnly;
    private boolean unknownOnly;
    private Long groupId;
    private boolean ungroupedOnly;

    /** Inclusive day bounds on lastSeenAt. */
    private LocalDate dateFrom;
    private LocalDate dateTo;

    private String textSearch;
}
