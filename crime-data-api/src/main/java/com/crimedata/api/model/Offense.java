package com.crimedata.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * One criminal act within an incident.
 */
@Data
@Builder
public class Offense {

    @JsonProperty("offense_id")
    private Long offenseId;

    /** Owning incident; used to attach offenses after the incident page is loaded */
    @JsonIgnore
    private Long incidentId;

    @JsonProperty("offense_type")
    private OffenseType offenseType;

    private Location location;
}
