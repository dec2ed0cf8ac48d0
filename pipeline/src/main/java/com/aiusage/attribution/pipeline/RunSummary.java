package com.aiusage.attribution.pipeline;

import com.aiusage.attribution.ingestion.FetchWindow;
import com.aiusage.attribution.reconciliation.ReconciliationReport;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Structured result of a run: per-source outcomes, anomaly totals and reconciliation reports.
 *
 * EXIT CODES:
 * - 0: every source succeeded
 * - 2: partial success; at least one source degraded, failed or was skipped
 * - 1: every source failed, or the run aborted on a fatal error
 * - 64: invalid invocation, assigned by the command line entry point
 */
public record RunSummary(
        String runId,
        FetchWindow window,
        Instant startedAt,
        Instant finishedAt,
        boolean cancelled,
        String fatalError,
        List<SourceOutcome> sources,
        List<ReconciliationReport> reconciliations
) {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_PARTIAL = 2;
    public static final int EXIT_USAGE = 64;

    public RunSummary {
        sources = List.copyOf(sources);
        reconciliations = List.copyOf(reconciliations);
    }

    @JsonProperty("exitCode")
    public int exitCode() {
        if (fatalError != null) {
            return EXIT_FAILURE;
        }
        if (!sources.isEmpty() && sources.stream().allMatch(SourceOutcome::isFailed)) {
            return EXIT_FAILURE;
        }
        boolean partial = cancelled || sources.stream().anyMatch(s -> s.getStatus() != SourceStatus.SUCCEEDED);
        return partial ? EXIT_PARTIAL : EXIT_SUCCESS;
    }

    @JsonProperty("anomalies")
    public Map<AnomalyCategory, Integer> anomalyTotals() {
        Map<AnomalyCategory, Integer> totals = new EnumMap<>(AnomalyCategory.class);
        for (SourceOutcome source : sources) {
            source.getAnomalies().forEach((category, count) -> totals.merge(category, count, Integer::sum));
        }
        long flagged = reconciliations.stream().filter(ReconciliationReport::isFlagged).count();
        if (flagged > 0) {
            totals.merge(AnomalyCategory.RECONCILIATION_VARIANCE, (int) flagged, Integer::sum);
        }
        return totals;
    }

    public SourceOutcome source(String sourceId) {
        return sources.stream()
                .filter(s -> s.getSourceId().equals(sourceId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No outcome for source " + sourceId));
    }
}
