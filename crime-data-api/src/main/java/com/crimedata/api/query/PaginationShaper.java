package com.crimedata.api.query;

import com.crimedata.api.config.CrimeDataProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Validates `page` / `page_size` and slices already-ordered results.
 *
 * Listings are sliced by the record store (ORDER BY ... LIMIT ... OFFSET); aggregate
 * rows, which only exist after aggregation, are sliced here.
 */
@Component
@RequiredArgsConstructor
public class PaginationShaper {

    private final CrimeDataProperties properties;

    public PageRequest resolve(String page, String pageSize) {
        CrimeDataProperties.Pagination config = properties.getPagination();

        int p = positiveInt("page", page, 1);
        int size = positiveInt("page_size", pageSize, config.getDefaultPageSize());
        if (config.getMaxPageSize() > 0 && size > config.getMaxPageSize()) {
            throw new InvalidParameterException("page_size",
                    "page_size must not exceed " + config.getMaxPageSize() + ", got " + size);
        }
        return new PageRequest(p, size);
    }

    /**
     * @param ordered rows in their final total order
     * @return the requested page; empty when the page lies beyond the end
     */
    public <T> List<T> slice(List<T> ordered, PageRequest request) {
        long from = request.offset();
        if (from >= ordered.size()) {
            return List.of();
        }
        int to = (int) Math.min(from + request.pageSize(), ordered.size());
        return List.copyOf(ordered.subList((int) from, to));
    }

    private int positiveInt(String param, String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) return defaultValue;
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidParameterException(param, param + " must be a positive integer, got \"" + raw + "\"");
        }
        if (value < 1) {
            throw new InvalidParameterException(param, param + " must be a positive integer, got " + value);
        }
        return value;
    }
}
