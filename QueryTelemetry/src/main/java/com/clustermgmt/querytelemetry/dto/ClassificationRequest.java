package com.clustermgmt.querytelemetry.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of a classification change. Null fields are left as they are;
 * clearGroup removes the group reference.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassificationRequest {

    private Boolean isKnown;
    private Long groupId;
    private boolean clearGroup;
}
