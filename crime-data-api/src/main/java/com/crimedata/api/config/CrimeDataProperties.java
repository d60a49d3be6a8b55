package com.crimedata.api.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "crime-data")
@Data
public class CrimeDataProperties {

    private Pagination pagination = new Pagination();
    private Count count = new Count();

    @Data
    public static class Pagination {
        private int defaultPageSize = 10;
        /** Largest accepted page_size; 0 leaves it unbounded */
        private int maxPageSize = 0;
    }

    @Data
    public static class Count {
        /** Grouping used by /incidents/count/ when no `by` parameter is sent */
        private String defaultBy = "year";
    }
}
