package com.crimedata.api.aggregator;

import com.crimedata.api.model.OffenseFact;

import java.util.HashSet;
import java.util.Set;

/**
 * Counts the distinct incidents behind the accepted offense facts.
 */
public class DistinctIncidentCount extends AbstractAggregator {

    private final Set<String> incidents = new HashSet<>();

    public DistinctIncidentCount(String fieldName) {
        super(fieldName);
    }

    public void accept(OffenseFact fact) {
        incidents.add(fact.getIncidentNumber());
    }

    public long getResult() {
        return incidents.size();
    }
}
