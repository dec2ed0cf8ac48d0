package com.aiusage.attribution.pipeline;

/**
 * Final state of one source within a run.
 */
public enum SourceStatus {
    /**
     * All payloads parsed and merged.
     */
    SUCCEEDED,

    /**
     * Merged, but some payloads or snapshots were dropped as anomalies.
     */
    DEGRADED,

    /**
     * Nothing merged for this source.
     */
    FAILED,

    /**
     * Not merged because the run was cancelled or aborted first.
     */
    SKIPPED
}
