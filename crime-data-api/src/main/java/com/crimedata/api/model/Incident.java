package com.crimedata.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A single reported crime event, as returned by the incident listing.
 *
 * Schema notes:
 *  - year is stored separately from incident_date; some agencies only report the year
 *  - the officer counts are LEOKA data (officers killed or assaulted) and default to 0
 */
@Data
@Builder
public class Incident {

    @JsonProperty("incident_id")
    private Long incidentId;

    @JsonProperty("incident_number")
    private String incidentNumber;

    private Integer year;

    @JsonProperty("incident_date")
    private LocalDate incidentDate;

    private Agency agency;

    @JsonProperty("officers_killed_felony")
    private int officersKilledFelony;

    @JsonProperty("officers_killed_accident")
    private int officersKilledAccident;

    @JsonProperty("officers_assaulted")
    private int officersAssaulted;

    @Builder.Default
    private List<Offense> offenses = new ArrayList<>();
}
