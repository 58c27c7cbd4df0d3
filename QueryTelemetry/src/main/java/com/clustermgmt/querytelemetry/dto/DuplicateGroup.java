package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Canonical rows of one target sharing the same canonical text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateGroup {

    private String canonicalText;
    private List<Long> canonicalQueryIds;
}
