package com.crimedata.api.query;

import java.util.ArrayList;
import java.util.List;

final class ParamLists {

    private ParamLists() {
    }

    /**
     * Split a comma-separated parameter value into trimmed tokens.
     * An empty token ("year,,state" or a trailing comma) is rejected.
     */
    static List<String> split(String parameter, String raw) {
        List<String> tokens = new ArrayList<>();
        for (String token : raw.split(",", -1)) {
            String trimmed = token.trim();
            if (trimmed.isEmpty()) {
                throw new InvalidParameterException(parameter,
                        "Empty value in '" + parameter + "' list: \"" + raw + "\"");
            }
            tokens.add(trimmed);
        }
        return tokens;
    }

    static boolean isAbsent(String raw) {
        return raw == null || raw.isBlank();
    }
}
