package com.crimedata.api.aggregator;

import com.crimedata.api.model.OffenseFact;

import java.util.HashSet;
import java.util.Set;
import java.util.function.ToIntFunction;

/**
 * Sums an incident-level value over the distinct incidents of a group.
 *
 * Incident values repeat on each of the incident's offense facts, so a value is
 * added only the first time its incident is seen.
 */
public class IncidentSum extends AbstractAggregator {

    private final ToIntFunction<OffenseFact> value;
    private final Set<String> seen = new HashSet<>();
    private long sum;

    public IncidentSum(String fieldName, ToIntFunction<OffenseFact> value) {
        super(fieldName);
        this.value = value;
    }

    public void accept(OffenseFact fact) {
        if (seen.add(fact.getIncidentNumber())) {
            int v = value.applyAsInt(fact);
            if (v < 0) {
                throw new IllegalStateException("Negative " + getFieldName() + " (" + v
                        + ") on incident " + fact.getIncidentNumber());
            }
            sum += v;
        }
    }

    public long getResult() {
        return sum;
    }
}
