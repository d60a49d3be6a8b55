package com.crimedata.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class Location {

    @JsonProperty("location_code")
    private String locationCode;

    @JsonProperty("location_name")
    private String locationName;
}
