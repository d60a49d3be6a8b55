package com.crimedata.api.service;

import com.crimedata.api.model.OffenseFact;
import com.crimedata.api.query.Dimension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tuple of grouping-key values for one fact. Equal when the values are equal;
 * ordered element by element with each dimension's own order.
 *
 * The first fact seen for the tuple is kept as its representative, so ordering
 * goes through the typed per-dimension comparators.
 */
final class GroupKey implements Comparable<GroupKey> {

    private final List<Dimension> dimensions;
    private final List<Object> values;
    private final OffenseFact representative;

    private GroupKey(List<Dimension> dimensions, List<Object> values, OffenseFact representative) {
        this.dimensions = dimensions;
        this.values = values;
        this.representative = representative;
    }

    static GroupKey of(OffenseFact fact, List<Dimension> dimensions) {
        List<Object> values = new ArrayList<>(dimensions.size());
        for (Dimension dimension : dimensions) {
            values.add(dimension.extract(fact));
        }
        return new GroupKey(dimensions, Collections.unmodifiableList(values), fact);
    }

    List<Object> values() {
        return values;
    }

    @Override
    public int compareTo(GroupKey other) {
        for (Dimension dimension : dimensions) {
            int c = dimension.order().compare(representative, other.representative);
            if (c != 0) return c;
        }
        return 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupKey)) return false;
        return values.equals(((GroupKey) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "GroupKey" + values;
    }
}
