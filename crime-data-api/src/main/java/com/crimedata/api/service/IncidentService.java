package com.crimedata.api.service;

import com.crimedata.api.model.Incident;
import com.crimedata.api.model.OffenseType;
import com.crimedata.api.query.FilterCompiler;
import com.crimedata.api.query.IncidentFilter;
import com.crimedata.api.query.NotFoundException;
import com.crimedata.api.query.PageRequest;
import com.crimedata.api.query.PaginationShaper;
import com.crimedata.api.store.RecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Record-level incident queries. Each listed incident embeds its agency and all
 * of its offenses, including offenses that did not match an offense_code filter.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentService {

    private final RecordStore recordStore;
    private final FilterCompiler filterCompiler;
    private final PaginationShaper paginationShaper;

    public List<Incident> list(String offenseCode, String year, String state, String ori,
                               String page, String pageSize) {
        IncidentFilter filter = filterCompiler.compile(offenseCode, year, state, ori);
        PageRequest request = paginationShaper.resolve(page, pageSize);

        List<Incident> incidents = recordStore.findIncidents(filter, request);
        log.debug("Incidents page {} with filter {}: {} rows", request.page(), filter, incidents.size());
        return incidents;
    }

    public Incident get(String incidentNumber) {
        return recordStore.findIncidentByNumber(incidentNumber)
                .orElseThrow(() -> new NotFoundException("Incident not found: " + incidentNumber));
    }

    public List<OffenseType> offenseTypes() {
        return recordStore.findOffenseTypes();
    }
}
