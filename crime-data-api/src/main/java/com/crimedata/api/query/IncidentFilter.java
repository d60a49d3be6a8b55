package com.crimedata.api.query;

import lombok.Builder;
import lombok.Value;

/**
 * Compiled filter constraints. A null member places no constraint; members
 * combine with AND.
 *
 * offenseCode is offense-level: an incident matches when at least one of its
 * offenses has the code, and only those offenses contribute to counts.
 */
@Value
@Builder
public class IncidentFilter {

    private static final IncidentFilter NONE = IncidentFilter.builder().build();

    private String offenseCode;
    private Integer year;
    private String state;
    private String ori;

    public static IncidentFilter none() {
        return NONE;
    }
}
