package com.crimedata.api.aggregator;

public abstract class AbstractAggregator implements Aggregator {

    private final String fieldName;

    AbstractAggregator(String fieldName) {
        this.fieldName = fieldName;
    }

    public final String getFieldName() {
        return fieldName;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + fieldName + "=" + getResult() + "]";
    }
}
