package com.crimedata.api.aggregator;

import com.crimedata.api.model.OffenseFact;

/**
 * Accumulates one output field of an aggregate row from the offense facts of
 * its group. Instances are per-group and per-request; they are not thread safe.
 */
public interface Aggregator {

    void accept(OffenseFact fact);

    String getFieldName();

    /** Result of the facts accepted so far; 0 when nothing was accepted */
    long getResult();
}
