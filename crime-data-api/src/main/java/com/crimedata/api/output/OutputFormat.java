package com.crimedata.api.output;

import com.crimedata.api.query.InvalidParameterException;

import java.util.Locale;

public enum OutputFormat {
    JSON, CSV;

    /** Absent means JSON */
    public static OutputFormat fromParam(String raw) {
        if (raw == null || raw.isBlank()) return JSON;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("output", "output must be json or csv, got \"" + raw + "\"");
        }
    }
}
