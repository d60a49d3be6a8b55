package com.crimedata.api.model;

import com.crimedata.api.query.CountField;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * One output row of the count endpoint: the grouping-key values, in dimension
 * order, and the requested fields, in request order.
 */
@Data
@Builder
public class AggregateRow {

    private List<Object> keys;

    private Map<CountField, Long> values;
}
