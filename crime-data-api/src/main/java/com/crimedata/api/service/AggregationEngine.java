package com.crimedata.api.service;

import com.crimedata.api.aggregator.Aggregator;
import com.crimedata.api.model.AggregateRow;
import com.crimedata.api.model.OffenseFact;
import com.crimedata.api.query.CountField;
import com.crimedata.api.query.Dimension;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups offense facts by a tuple of dimensions and runs one aggregator per
 * requested field in each group.
 *
 * Only observed key combinations produce a row; there is no zero-filling.
 * Rows come back ordered by key tuple, which is the total order pagination
 * relies on.
 */
@Component
@Slf4j
public class AggregationEngine {

    public List<AggregateRow> aggregate(List<OffenseFact> facts, List<Dimension> dimensions, List<CountField> fields) {
        if (dimensions.isEmpty()) {
            throw new IllegalStateException("At least one grouping dimension is required");
        }

        Map<GroupKey, List<Aggregator>> groups = new TreeMap<>();
        for (OffenseFact fact : facts) {
            List<Aggregator> aggregators = groups.computeIfAbsent(
                    GroupKey.of(fact, dimensions), k -> newAggregators(dimensions, fields));
            for (Aggregator aggregator : aggregators) {
                aggregator.accept(fact);
            }
        }

        List<AggregateRow> rows = new ArrayList<>(groups.size());
        groups.forEach((key, aggregators) -> rows.add(toRow(key, aggregators, fields)));

        log.debug("Aggregated {} facts into {} groups by {}", facts.size(), rows.size(), dimensions);
        return rows;
    }

    private List<Aggregator> newAggregators(List<Dimension> dimensions, List<CountField> fields) {
        List<Aggregator> aggregators = new ArrayList<>(fields.size());
        for (CountField field : fields) {
            aggregators.add(field.newAggregator(dimensions));
        }
        return aggregators;
    }

    private AggregateRow toRow(GroupKey key, List<Aggregator> aggregators, List<CountField> fields) {
        Map<CountField, Long> values = new LinkedHashMap<>();
        for (int i = 0; i < fields.size(); i++) {
            values.put(fields.get(i), aggregators.get(i).getResult());
        }
        return AggregateRow.builder()
                .keys(new ArrayList<>(key.values()))
                .values(values)
                .build();
    }
}
