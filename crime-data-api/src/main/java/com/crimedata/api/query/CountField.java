package com.crimedata.api.query;

import com.crimedata.api.aggregator.Aggregator;
import com.crimedata.api.aggregator.Count;
import com.crimedata.api.aggregator.DistinctIncidentCount;
import com.crimedata.api.aggregator.IncidentSum;
import com.crimedata.api.model.OffenseFact;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Registry of the numeric fields the count endpoint can emit.
 *
 * A field is requested by name through the `fields` parameter and computed by
 * the aggregator this enum creates for it.
 */
public enum CountField {

    TOTAL_ACTUAL_COUNT("total_actual_count"),
    INCIDENT_COUNT("incident_count"),
    OFFENSE_COUNT("offense_count"),
    LEOKA_FELONY("leoka_felony"),
    LEOKA_ACCIDENT("leoka_accident"),
    LEOKA_ASSAULT("leoka_assault");

    private final String fieldName;

    CountField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }

    /**
     * Create a fresh aggregator for one group.
     *
     * total_actual_count counts offense occurrences once any grouping dimension is
     * offense-scoped, and distinct incidents otherwise.
     */
    public Aggregator newAggregator(List<Dimension> dimensions) {
        return switch (this) {
            case TOTAL_ACTUAL_COUNT -> isOffenseScoped(dimensions)
                    ? new Count(fieldName)
                    : new DistinctIncidentCount(fieldName);
            case INCIDENT_COUNT -> new DistinctIncidentCount(fieldName);
            case OFFENSE_COUNT -> new Count(fieldName);
            case LEOKA_FELONY -> new IncidentSum(fieldName, OffenseFact::getOfficersKilledFelony);
            case LEOKA_ACCIDENT -> new IncidentSum(fieldName, OffenseFact::getOfficersKilledAccident);
            case LEOKA_ASSAULT -> new IncidentSum(fieldName, OffenseFact::getOfficersAssaulted);
        };
    }

    public static Optional<CountField> fromName(String name) {
        return Arrays.stream(values())
                .filter(f -> f.fieldName.equals(name))
                .findFirst();
    }

    private static boolean isOffenseScoped(List<Dimension> dimensions) {
        return dimensions.stream().anyMatch(d -> d.scope() == Dimension.Scope.OFFENSE);
    }
}
