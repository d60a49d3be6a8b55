package com.crimedata.api.query;

import com.crimedata.api.model.OffenseFact;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Function;

/**
 * Grouping dimensions supported by the count endpoint.
 *
 * Each constant owns the function that extracts its key from an offense fact
 * and the ascending, nulls-first order of that key, so adding a dimension means
 * adding a constant here and nothing else.
 */
public enum Dimension {

    YEAR("year", Scope.INCIDENT, OffenseFact::getYear),
    AGENCY_ID("agency_id", Scope.INCIDENT, OffenseFact::getAgencyId),
    STATE("state", Scope.INCIDENT, OffenseFact::getState),
    OFFENSE("offense", Scope.OFFENSE, OffenseFact::getOffenseName);

    /**
     * Whether a dimension's value belongs to the incident (shared by all of its
     * offenses) or to the individual offense.
     */
    public enum Scope {
        INCIDENT, OFFENSE
    }

    private final String token;
    private final Scope scope;
    private final Function<OffenseFact, Object> extractor;
    private final Comparator<OffenseFact> order;

    <T extends Comparable<? super T>> Dimension(String token, Scope scope, Function<OffenseFact, T> key) {
        this.token = token;
        this.scope = scope;
        this.extractor = key::apply;
        this.order = Comparator.comparing(key, Comparator.nullsFirst(Comparator.<T>naturalOrder()));
    }

    /** Column name used both in the `by` parameter and in output rows */
    public String token() {
        return token;
    }

    public Scope scope() {
        return scope;
    }

    public Object extract(OffenseFact fact) {
        return extractor.apply(fact);
    }

    /** Orders facts by this dimension's key, ascending with nulls first */
    public Comparator<OffenseFact> order() {
        return order;
    }

    public static Optional<Dimension> fromToken(String token) {
        return Arrays.stream(values())
                .filter(d -> d.token.equals(token))
                .findFirst();
    }
}
