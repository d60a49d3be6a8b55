package com.crimedata.api.query;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the `fields` parameter against the {@link CountField} registry.
 */
@Component
public class FieldResolver {

    static final String PARAM = "fields";

    public List<CountField> resolve(String raw) {
        if (ParamLists.isAbsent(raw)) {
            return List.of(CountField.TOTAL_ACTUAL_COUNT);
        }

        Set<CountField> resolved = new LinkedHashSet<>();
        for (String token : ParamLists.split(PARAM, raw)) {
            CountField field = CountField.fromName(token)
                    .orElseThrow(() -> new InvalidParameterException(PARAM,
                            "Unknown field '" + token + "'; expected one of " + registry()));
            resolved.add(field);
        }
        return new ArrayList<>(resolved);
    }

    private static String registry() {
        return Arrays.stream(CountField.values())
                .map(CountField::fieldName)
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
