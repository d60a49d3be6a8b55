package com.crimedata.api.query;

/**
 * A validated 1-indexed page of a stably ordered result.
 */
public record PageRequest(int page, int pageSize) {

    public long offset() {
        return (long) (page - 1) * pageSize;
    }
}
