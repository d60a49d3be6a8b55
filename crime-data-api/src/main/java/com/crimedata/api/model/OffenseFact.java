package com.crimedata.api.model;

import lombok.Builder;
import lombok.Data;

/**
 * Flattened offense occurrence: one row per offense, carrying the attributes of
 * its incident and owning agency. This is the unit the count endpoint aggregates.
 */
@Data
@Builder
public class OffenseFact {

    // ── Incident ────────────────────────────────────────────────────────────
    private String incidentNumber;
    private Integer year;

    /** LEOKA counts repeat on every offense of the same incident */
    private int officersKilledFelony;
    private int officersKilledAccident;
    private int officersAssaulted;

    // ── Agency ──────────────────────────────────────────────────────────────
    private Long agencyId;
    private String state;

    // ── Offense ─────────────────────────────────────────────────────────────
    private String offenseCode;
    private String offenseName;
}
