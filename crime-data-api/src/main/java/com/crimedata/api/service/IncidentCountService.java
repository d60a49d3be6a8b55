package com.crimedata.api.service;

import com.crimedata.api.model.AggregateRow;
import com.crimedata.api.model.OffenseFact;
import com.crimedata.api.query.CountQuery;
import com.crimedata.api.query.DimensionResolver;
import com.crimedata.api.query.FieldResolver;
import com.crimedata.api.query.FilterCompiler;
import com.crimedata.api.query.PaginationShaper;
import com.crimedata.api.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Backs GET /incidents/count/.
 *
 * Every parameter is validated in {@link #resolve} before the record store is
 * touched, so a bad request costs no database work.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentCountService {

    private final DimensionResolver dimensionResolver;
    private final FieldResolver fieldResolver;
    private final FilterCompiler filterCompiler;
    private final PaginationShaper paginationShaper;
    private final AggregationEngine aggregationEngine;
    private final RecordStore recordStore;

    public CountQuery resolve(String by, String fields,
                              String offenseCode, String year, String state, String ori,
                              String page, String pageSize) {
        return new CountQuery(
                dimensionResolver.resolve(by),
                fieldResolver.resolve(fields),
                filterCompiler.compile(offenseCode, year, state, ori),
                paginationShaper.resolve(page, pageSize));
    }

    /**
     * @return the requested page of aggregate rows, ordered by grouping-key tuple
     */
    public List<AggregateRow> count(CountQuery query) {
        List<OffenseFact> facts = recordStore.findOffenseFacts(query.filter());
        List<AggregateRow> rows = aggregationEngine.aggregate(facts, query.dimensions(), query.fields());
        List<AggregateRow> page = paginationShaper.slice(rows, query.page());

        log.info("Counted {} facts by {} into {} rows; returning page {} ({} rows)",
                facts.size(), query.dimensions(), rows.size(), query.page().page(), page.size());
        return page;
    }
}
