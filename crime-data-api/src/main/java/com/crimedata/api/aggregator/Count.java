package com.crimedata.api.aggregator;

import com.crimedata.api.model.OffenseFact;

/**
 * Counts offense occurrences.
 */
public class Count extends AbstractAggregator {

    private long count;

    public Count(String fieldName) {
        super(fieldName);
    }

    public void accept(OffenseFact fact) {
        count++;
    }

    public long getResult() {
        return count;
    }
}
