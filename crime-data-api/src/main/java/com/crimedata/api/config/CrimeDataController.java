package com.crimedata.api.config;

import com.crimedata.api.model.AggregateRow;
import com.crimedata.api.output.OutputFormat;
import com.crimedata.api.output.ResponseAssembler;
import com.crimedata.api.query.CountQuery;
import com.crimedata.api.query.InvalidParameterException;
import com.crimedata.api.query.NotFoundException;
import com.crimedata.api.service.AgencyService;
import com.crimedata.api.service.IncidentCountService;
import com.crimedata.api.service.IncidentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@RestController
@Slf4j
@RequiredArgsConstructor
public class CrimeDataController {

    private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

    private final AgencyService agencyService;
    private final IncidentService incidentService;
    private final IncidentCountService countService;
    private final ResponseAssembler responseAssembler;

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "crime-data-api",
                "version", "1.0.0"
        ));
    }

    // ── Agencies ─────────────────────────────────────────────────────────────

    /**
     * GET /agencies/?page=2&page_size=10
     */
    @GetMapping({"/agencies", "/agencies/"})
    public ResponseEntity<?> listAgencies(
            @RequestParam(required = false) String page,
            @RequestParam(name = "page_size", required = false) String pageSize) {
        return handle("agency listing", () -> ResponseEntity.ok(agencyService.list(page, pageSize)));
    }

    @GetMapping({"/agencies/{ori}", "/agencies/{ori}/"})
    public ResponseEntity<?> getAgency(@PathVariable String ori) {
        return handle("agency " + ori, () -> ResponseEntity.ok(agencyService.get(ori)));
    }

    // ── Incidents ────────────────────────────────────────────────────────────

    /**
     * GET /incidents/?offense_code=35A&page=1&page_size=10
     *
     * Returns incidents with at least one matching offense; each embeds its agency
     * and all of its offenses.
     */
    @GetMapping({"/incidents", "/incidents/"})
    public ResponseEntity<?> listIncidents(
            @RequestParam(name = "offense_code", required = false) String offenseCode,
            @RequestParam(required = false) String year,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String ori,
            @RequestParam(required = false) String page,
            @RequestParam(name = "page_size", required = false) String pageSize) {
        return handle("incident listing", () -> ResponseEntity.ok(
                incidentService.list(offenseCode, year, state, ori, page, pageSize)));
    }

    /**
     * GET /incidents/count/?by=agency_id,year&fields=leoka_felony&output=csv
     *
     * Grouped counts, one row per observed combination of the `by` dimensions.
     */
    @GetMapping({"/incidents/count", "/incidents/count/"})
    public ResponseEntity<?> countIncidents(
            @RequestParam(required = false) String by,
            @RequestParam(required = false) String fields,
            @RequestParam(name = "offense_code", required = false) String offenseCode,
            @RequestParam(required = false) String year,
            @RequestParam(required = false) String state,
            @RequestParam(required = false) String ori,
            @RequestParam(required = false) String page,
            @RequestParam(name = "page_size", required = false) String pageSize,
            @RequestParam(required = false) String output) {
        return handle("incident count", () -> {
            CountQuery query = countService.resolve(by, fields, offenseCode, year, state, ori, page, pageSize);
            OutputFormat format = OutputFormat.fromParam(output);

            List<AggregateRow> rows = countService.count(query);
            if (format == OutputFormat.CSV) {
                return ResponseEntity.ok()
                        .contentType(TEXT_CSV)
                        .body(responseAssembler.toCsv(query, rows));
            }
            return ResponseEntity.ok(responseAssembler.toMaps(query, rows));
        });
    }

    @GetMapping({"/incidents/{incidentNumber}", "/incidents/{incidentNumber}/"})
    public ResponseEntity<?> getIncident(@PathVariable String incidentNumber) {
        return handle("incident " + incidentNumber, () -> ResponseEntity.ok(incidentService.get(incidentNumber)));
    }

    // ── Lookups ──────────────────────────────────────────────────────────────

    @GetMapping({"/offenses/types", "/offenses/types/"})
    public ResponseEntity<?> offenseTypes() {
        return handle("offense types", () -> ResponseEntity.ok(incidentService.offenseTypes()));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private ResponseEntity<?> handle(String what, Supplier<ResponseEntity<?>> action) {
        try {
            return action.get();
        } catch (InvalidParameterException e) {
            log.warn("Rejected {} request: {}", what, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of(
                    "error", e.getMessage(),
                    "parameter", e.getParameter()));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("{} failed: {}", what, e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }
}
