package com.crimedata.api.store;

import com.crimedata.api.model.Agency;
import com.crimedata.api.model.Incident;
import com.crimedata.api.model.OffenseFact;
import com.crimedata.api.model.OffenseType;
import com.crimedata.api.query.IncidentFilter;
import com.crimedata.api.query.PageRequest;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the normalized incident data.
 *
 * Listings come back in a fixed total order so consecutive pages never overlap:
 * agencies by ORI, incidents by incident number, each with the surrogate key as
 * tie-break.
 */
public interface RecordStore {

    List<Agency> findAgencies(PageRequest page);

    Optional<Agency> findAgencyByOri(String ori);

    /** Incidents with at least one offense matching the filter, offenses embedded */
    List<Incident> findIncidents(IncidentFilter filter, PageRequest page);

    Optional<Incident> findIncidentByNumber(String incidentNumber);

    /** One fact per offense matching the filter; non-matching offenses are excluded */
    List<OffenseFact> findOffenseFacts(IncidentFilter filter);

    List<OffenseType> findOffenseTypes();
}
