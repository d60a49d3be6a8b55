package com.crimedata.api.query;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates raw filter parameters and compiles them into an {@link IncidentFilter}.
 *
 * Only the syntax of a value is checked here. A well-formed value that matches
 * no record is valid and simply produces an empty result.
 */
@Component
public class FilterCompiler {

    private static final Pattern OFFENSE_CODE = Pattern.compile("[0-9A-Z]{2,4}");
    private static final Pattern STATE = Pattern.compile("[A-Z]{2}");
    private static final Pattern ORI = Pattern.compile("[0-9A-Z]{7,9}");

    public IncidentFilter compile(String offenseCode, String year, String state, String ori) {
        return IncidentFilter.builder()
                .offenseCode(code("offense_code", offenseCode, OFFENSE_CODE))
                .year(year(year))
                .state(code("state", state, STATE))
                .ori(code("ori", ori, ORI))
                .build();
    }

    private String code(String param, String raw, Pattern pattern) {
        if (raw == null || raw.isBlank()) return null;
        String normalised = raw.trim().toUpperCase(Locale.ROOT);
        if (!pattern.matcher(normalised).matches()) {
            throw new InvalidParameterException(param, "Malformed " + param + ": \"" + raw + "\"");
        }
        return normalised;
    }

    private Integer year(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            int year = Integer.parseInt(raw.trim());
            if (year < 1) {
                throw new InvalidParameterException("year", "year must be positive, got " + year);
            }
            return year;
        } catch (NumberFormatException e) {
            throw new InvalidParameterException("year", "year must be an integer, got \"" + raw + "\"");
        }
    }
}
