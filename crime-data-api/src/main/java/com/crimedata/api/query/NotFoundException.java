package com.crimedata.api.query;

/**
 * A single-record lookup (agency by ORI, incident by number) matched nothing.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}
