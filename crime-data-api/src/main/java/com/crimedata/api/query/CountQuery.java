package com.crimedata.api.query;

import java.util.List;

/**
 * Fully validated parameters of one count request.
 */
public record CountQuery(List<Dimension> dimensions,
                         List<CountField> fields,
                         IncidentFilter filter,
                         PageRequest page) {
}
