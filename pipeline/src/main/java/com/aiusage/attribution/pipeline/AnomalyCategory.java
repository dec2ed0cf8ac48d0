package com.aiusage.attribution.pipeline;

/**
 * Categories under which every irregularity of a run is counted in the run summary.
 */
public enum AnomalyCategory {
    /**
     * A payload or a fragment of it could not be parsed into a record.
     */
    SOURCE_UNPARSEABLE,

    /**
     * A record could not be attributed to a user. A coverage metric, not a fault.
     */
    IDENTITY_UNRESOLVED,

    /**
     * A cumulative snapshot contradicted the billing cycle history and was excluded.
     */
    CYCLE_BOUNDARY_ANOMALY,

    /**
     * Storage contention while merging facts.
     */
    MERGE_CONFLICT,

    /**
     * The fact store rejected a source's batch, or the batch could not be written.
     */
    MERGE_REJECTED,

    /**
     * Aggregated cost outside tolerance of an invoice total.
     */
    RECONCILIATION_VARIANCE,

    /**
     * The source adapter could not deliver any payload.
     */
    SOURCE_FETCH_FAILED,

    /**
     * An organization-wide aggregate dropped in favour of its breakdown.
     */
    SCOPE_OVERLAP_SUPPRESSED,

    /**
     * A first cumulative snapshot kept as baseline without emitting a delta.
     */
    BASELINE_HELD
}
