package com.crimedata.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class OffenseType {

    /** NIBRS offense code, e.g. "35A" */
    @JsonProperty("offense_code")
    private String offenseCode;

    @JsonProperty("offense_name")
    private String offenseName;

    @JsonProperty("offense_category")
    private String offenseCategory;
}
