package com.crimedata.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * A law-enforcement reporting agency.
 *
 * The ORI is the natural key used on the public surface; agency_id is the
 * numeric surrogate used as a grouping dimension by the count endpoint.
 */
@Data
@Builder
public class Agency {

    @JsonProperty("agency_id")
    private Long agencyId;

    /** Originating agency identifier, e.g. "VA0290000" */
    private String ori;

    @JsonProperty("agency_name")
    private String agencyName;

    /** Two-letter state code */
    private String state;
}
