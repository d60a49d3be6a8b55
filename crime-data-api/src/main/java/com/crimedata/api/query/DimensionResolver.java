package com.crimedata.api.query;

import com.crimedata.api.config.CrimeDataProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the `by` parameter of the count endpoint into an ordered list of
 * grouping dimensions.
 */
@Component
@RequiredArgsConstructor
public class DimensionResolver {

    static final String PARAM = "by";

    private final CrimeDataProperties properties;

    /**
     * @param raw comma-separated dimension tokens, e.g. "agency_id,year"; null or blank
     *            falls back to the configured default grouping
     * @return dimensions in request order with repeats removed
     * @throws InvalidParameterException if a token is empty or unknown
     */
    public List<Dimension> resolve(String raw) {
        String value = ParamLists.isAbsent(raw) ? properties.getCount().getDefaultBy() : raw;

        Set<Dimension> resolved = new LinkedHashSet<>();
        for (String token : ParamLists.split(PARAM, value)) {
            Dimension dimension = Dimension.fromToken(token)
                    .orElseThrow(() -> new InvalidParameterException(PARAM,
                            "Unknown grouping dimension '" + token + "'; expected one of " + vocabulary()));
            resolved.add(dimension);
        }
        return new ArrayList<>(resolved);
    }

    private static String vocabulary() {
        return Arrays.stream(Dimension.values())
                .map(Dimension::token)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
