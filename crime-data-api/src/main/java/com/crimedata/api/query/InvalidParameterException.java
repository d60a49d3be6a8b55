package com.crimedata.api.query;

import lombok.Getter;

/**
 * Raised when a query parameter is malformed or names something outside the
 * supported vocabulary. Surfaced to clients as HTTP 400.
 */
@Getter
public class InvalidParameterException extends IllegalArgumentException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }
}
