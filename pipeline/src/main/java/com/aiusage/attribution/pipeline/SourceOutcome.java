package com.aiusage.attribution.pipeline;

import com.aiusage.attribution.domain.model.ResolutionMethod;
import com.aiusage.attribution.facts.AssemblyResult;
import com.aiusage.attribution.facts.BackfillOutcome;
import com.aiusage.attribution.facts.MergeOutcome;
import com.aiusage.attribution.identity.AttributionSummary;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-source counters of a run. Written by the worker preparing the source,
 * then by the merging thread once the worker's future has completed.
 */
@Getter
public class SourceOutcome {

    private static final int MAX_MESSAGES = 20;

    private final String sourceId;
    private SourceStatus status;
    private String failureReason;

    private int payloads;
    private int recordsNormalized;
    private int recordsOutOfWindow;
    private int duplicatesCollapsed;
    private int collisionsSummed;
    private int costAmountsIgnored;
    private int cycleBoundaryEvents;
    private int factsInserted;
    private int factsReplaced;
    private int factsUnchanged;
    private int checkpointsWritten;
    private int payloadsArchived;
    private int factsBackfilled;
    private AttributionSummary attribution;
    private final Map<AnomalyCategory, Integer> anomalies = new EnumMap<>(AnomalyCategory.class);
    private final List<String> messages = new ArrayList<>();

    public SourceOutcome(String sourceId) {
        this.sourceId = sourceId;
    }

    public void count(AnomalyCategory category, long occurrences) {
        if (occurrences > 0) {
            anomalies.merge(category, (int) occurrences, Integer::sum);
        }
    }

    public int anomalyCount(AnomalyCategory category) {
        return anomalies.getOrDefault(category, 0);
    }

    public void note(String message) {
        if (messages.size() < MAX_MESSAGES) {
            messages.add(message);
        }
    }

    public void fail(AnomalyCategory category, String reason) {
        count(category, 1);
        status = SourceStatus.FAILED;
        failureReason = reason;
    }

    public void skip(String reason) {
        if (status != SourceStatus.FAILED) {
            status = SourceStatus.SKIPPED;
            failureReason = reason;
        }
    }

    public boolean isFailed() {
        return status == SourceStatus.FAILED || status == SourceStatus.SKIPPED;
    }

    void recordNormalization(int payloadCount, int records, int outOfWindow) {
        payloads = payloadCount;
        recordsNormalized = records;
        recordsOutOfWindow = outOfWindow;
    }

    void recordAttribution(AttributionSummary summary) {
        attribution = summary;
        count(AnomalyCategory.IDENTITY_UNRESOLVED, summary.byMethod().getOrDefault(ResolutionMethod.UNRESOLVED, 0L));
    }

    void recordBoundaryEvents(int events) {
        cycleBoundaryEvents += events;
    }

    void recordAssembly(AssemblyResult assembly) {
        duplicatesCollapsed = assembly.duplicatesCollapsed();
        collisionsSummed = assembly.collisionsSummed();
        costAmountsIgnored = assembly.costAmountsIgnored();
        count(AnomalyCategory.SCOPE_OVERLAP_SUPPRESSED, assembly.overlapSuppressed());
    }

    void recordMerge(MergeOutcome merge) {
        factsInserted = merge.inserted();
        factsReplaced = merge.replaced();
        factsUnchanged = merge.unchanged();
        checkpointsWritten = merge.checkpointsWritten();
        count(AnomalyCategory.MERGE_CONFLICT, Math.max(0, merge.attempts() - 1));
    }

    void recordArchive(int archived) {
        payloadsArchived = archived;
    }

    void recordBackfill(BackfillOutcome backfill) {
        factsBackfilled = backfill.usageDeleted() + backfill.costDeleted();
    }

    /**
     * Settle the final status of a source that was not failed or skipped.
     */
    void complete() {
        if (status != null) {
            return;
        }
        boolean degraded = anomalyCount(AnomalyCategory.SOURCE_UNPARSEABLE) > 0
                || anomalyCount(AnomalyCategory.CYCLE_BOUNDARY_ANOMALY) > 0
                || anomalyCount(AnomalyCategory.MERGE_CONFLICT) > 0;
        status = degraded ? SourceStatus.DEGRADED : SourceStatus.SUCCEEDED;
    }

    public Map<AnomalyCategory, Integer> getAnomalies() {
        return Collections.unmodifiableMap(anomalies);
    }

    public List<String> getMessages() {
        return Collections.unmodifiableList(messages);
    }
}
