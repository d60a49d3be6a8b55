package com.crimedata.api.store;

import com.crimedata.api.model.Agency;
import com.crimedata.api.model.Incident;
import com.crimedata.api.model.Location;
import com.crimedata.api.model.Offense;
import com.crimedata.api.model.OffenseFact;
import com.crimedata.api.model.OffenseType;
import com.crimedata.api.query.IncidentFilter;
import com.crimedata.api.query.PageRequest;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link RecordStore} over the relational incident schema (agency, incident,
 * offense, offense_type, location).
 *
 * Reads are retried by Resilience4j on connection-level failures; anything still
 * failing after the retries propagates to the caller.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcRecordStore implements RecordStore {

    private static final String AGENCY_COLUMNS = "a.agency_id, a.ori, a.agency_name, a.state";

    private static final String INCIDENT_SELECT = """
            SELECT i.incident_id, i.incident_number, i.incident_year, i.incident_date,
                   i.officers_killed_felony, i.officers_killed_accident, i.officers_assaulted,
                   a.agency_id, a.ori, a.agency_name, a.state
            FROM incident i
            JOIN agency a ON a.agency_id = i.agency_id
            """;

    private final JdbcTemplate jdbcTemplate;

    // ── Agencies ─────────────────────────────────────────────────────────────

    @Override
    @Retry(name = "recordStore")
    public List<Agency> findAgencies(PageRequest page) {
        String sql = "SELECT " + AGENCY_COLUMNS + " FROM agency a"
                + " ORDER BY a.ori ASC, a.agency_id ASC LIMIT ? OFFSET ?";
        log.debug("Loading agencies page {} (size {})", page.page(), page.pageSize());
        return jdbcTemplate.query(sql, AGENCY_MAPPER, page.pageSize(), page.offset());
    }

    @Override
    @Retry(name = "recordStore")
    public Optional<Agency> findAgencyByOri(String ori) {
        String sql = "SELECT " + AGENCY_COLUMNS + " FROM agency a WHERE a.ori = ?";
        return jdbcTemplate.query(sql, AGENCY_MAPPER, ori).stream().findFirst();
    }

    // ── Incidents ────────────────────────────────────────────────────────────

    @Override
    @Retry(name = "recordStore")
    public List<Incident> findIncidents(IncidentFilter filter, PageRequest page) {
        Where where = incidentWhere(filter);
        List<Object> args = new ArrayList<>(where.args);
        args.add(page.pageSize());
        args.add(page.offset());

        String sql = INCIDENT_SELECT + where.sql()
                + " ORDER BY i.incident_number ASC, i.incident_id ASC LIMIT ? OFFSET ?";
        log.debug("Loading incidents page {} (size {}) with filter {}", page.page(), page.pageSize(), filter);

        List<Incident> incidents = jdbcTemplate.query(sql, INCIDENT_MAPPER, args.toArray());
        attachOffenses(incidents);
        return incidents;
    }

    @Override
    @Retry(name = "recordStore")
    public Optional<Incident> findIncidentByNumber(String incidentNumber) {
        String sql = INCIDENT_SELECT + " WHERE i.incident_number = ?";
        List<Incident> incidents = jdbcTemplate.query(sql, INCIDENT_MAPPER, incidentNumber);
        attachOffenses(incidents);
        return incidents.stream().findFirst();
    }

    // ── Aggregation input ────────────────────────────────────────────────────

    @Override
    @Retry(name = "recordStore")
    public List<OffenseFact> findOffenseFacts(IncidentFilter filter) {
        Where where = new Where();
        if (filter.getOffenseCode() != null) where.and("o.offense_code = ?", filter.getOffenseCode());
        addAgencyAndYear(where, filter);

        String sql = """
                SELECT i.incident_number, i.incident_year,
                       i.officers_killed_felony, i.officers_killed_accident, i.officers_assaulted,
                       a.agency_id, a.state,
                       o.offense_code, t.offense_name
                FROM offense o
                JOIN incident i ON i.incident_id = o.incident_id
                JOIN agency a ON a.agency_id = i.agency_id
                JOIN offense_type t ON t.offense_code = o.offense_code
                """ + where.sql() + " ORDER BY i.incident_number ASC, o.offense_id ASC";

        List<OffenseFact> facts = jdbcTemplate.query(sql, FACT_MAPPER, where.args.toArray());
        log.debug("Loaded {} offense facts with filter {}", facts.size(), filter);
        return facts;
    }

    @Override
    @Retry(name = "recordStore")
    public List<OffenseType> findOffenseTypes() {
        return jdbcTemplate.query("""
                SELECT offense_code, offense_name, offense_category
                FROM offense_type
                ORDER BY offense_code ASC
                """, OFFENSE_TYPE_MAPPER);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Load the offenses of the given incidents in one query and attach them in
     * offense_id order.
     */
    private void attachOffenses(List<Incident> incidents) {
        if (incidents.isEmpty()) return;

        String placeholders = String.join(",", Collections.nCopies(incidents.size(), "?"));
        String sql = """
                SELECT o.offense_id, o.incident_id,
                       t.offense_code, t.offense_name, t.offense_category,
                       l.location_code, l.location_name
                FROM offense o
                JOIN offense_type t ON t.offense_code = o.offense_code
                JOIN location l ON l.location_code = o.location_code
                WHERE o.incident_id IN (%s)
                ORDER BY o.incident_id ASC, o.offense_id ASC
                """.formatted(placeholders);

        Object[] ids = incidents.stream().map(Incident::getIncidentId).toArray();
        Map<Long, Incident> byId = incidents.stream()
                .collect(Collectors.toMap(Incident::getIncidentId, Function.identity()));

        for (Offense offense : jdbcTemplate.query(sql, OFFENSE_MAPPER, ids)) {
            byId.get(offense.getIncidentId()).getOffenses().add(offense);
        }
    }

    private Where incidentWhere(IncidentFilter filter) {
        Where where = new Where();
        if (filter.getOffenseCode() != null) {
            where.and("i.incident_id IN (SELECT o.incident_id FROM offense o WHERE o.offense_code = ?)",
                    filter.getOffenseCode());
        }
        addAgencyAndYear(where, filter);
        return where;
    }

    private void addAgencyAndYear(Where where, IncidentFilter filter) {
        if (filter.getYear() != null) where.and("i.incident_year = ?", filter.getYear());
        if (filter.getState() != null) where.and("a.state = ?", filter.getState());
        if (filter.getOri() != null) where.and("a.ori = ?", filter.getOri());
    }

    /** Conjunctive WHERE clause with positional arguments */
    private static final class Where {
        private final List<String> clauses = new ArrayList<>();
        private final List<Object> args = new ArrayList<>();

        void and(String clause, Object arg) {
            clauses.add(clause);
            args.add(arg);
        }

        String sql() {
            return clauses.isEmpty() ? "" : " WHERE " + String.join(" AND ", clauses);
        }
    }

    // ── Row mappers ──────────────────────────────────────────────────────────

    private static final RowMapper<Agency> AGENCY_MAPPER = (rs, rowNum) -> agency(rs);

    private static final RowMapper<Incident> INCIDENT_MAPPER = (rs, rowNum) -> {
        Date date = rs.getDate("incident_date");
        return Incident.builder()
                .incidentId(rs.getLong("incident_id"))
                .incidentNumber(rs.getString("incident_number"))
                .year(rs.getInt("incident_year"))
                .incidentDate(date != null ? date.toLocalDate() : null)
                .officersKilledFelony(rs.getInt("officers_killed_felony"))
                .officersKilledAccident(rs.getInt("officers_killed_accident"))
                .officersAssaulted(rs.getInt("officers_assaulted"))
                .agency(agency(rs))
                .build();
    };

    private static final RowMapper<Offense> OFFENSE_MAPPER = (rs, rowNum) -> Offense.builder()
            .offenseId(rs.getLong("offense_id"))
            .incidentId(rs.getLong("incident_id"))
            .offenseType(offenseType(rs))
            .location(Location.builder()
                    .locationCode(rs.getString("location_code"))
                    .locationName(rs.getString("location_name"))
                    .build())
            .build();

    private static final RowMapper<OffenseType> OFFENSE_TYPE_MAPPER = (rs, rowNum) -> offenseType(rs);

    private static final RowMapper<OffenseFact> FACT_MAPPER = (rs, rowNum) -> OffenseFact.builder()
            .incidentNumber(rs.getString("incident_number"))
            .year(rs.getInt("incident_year"))
            .officersKilledFelony(rs.getInt("officers_killed_felony"))
            .officersKilledAccident(rs.getInt("officers_killed_accident"))
            .officersAssaulted(rs.getInt("officers_assaulted"))
            .agencyId(rs.getLong("agency_id"))
            .state(rs.getString("state"))
            .offenseCode(rs.getString("offense_code"))
            .offenseName(rs.getString("offense_name"))
            .build();

    private static Agency agency(ResultSet rs) throws SQLException {
        return Agency.builder()
                .agencyId(rs.getLong("agency_id"))
                .ori(rs.getString("ori"))
                .agencyName(rs.getString("agency_name"))
                .state(rs.getString("state"))
                .build();
    }

    private static OffenseType offenseType(ResultSet rs) throws SQLException {
        return OffenseType.builder()
                .offenseCode(rs.getString("offense_code"))
                .offenseName(rs.getString("offense_name"))
                .offenseCategory(rs.getString("offense_category"))
                .build();
    }
}
