package com.aiusage.attribution.normalization;

import com.aiusage.attribution.domain.model.RawRecord;

import java.util.List;

/**
 * Output of delta normalization for one billing entity.
 *
 * @param deltas         non-cumulative records, one per accepted snapshot that emitted a delta
 * @param boundaryEvents cycle rollovers detected along the sequence
 * @param excluded       snapshots dropped as duplicates or anomalies
 * @param heldBaselines  first snapshots kept as baseline only
 * @param checkpoints    cumulative state after every accepted snapshot, for the next run
 */
public record DeltaResult(
        List<RawRecord> deltas,
        List<CycleBoundaryEvent> boundaryEvents,
        List<ExcludedSnapshot> excluded,
        List<RawRecord> heldBaselines,
        List<CumulativeBaseline> checkpoints
) {

    public long anomalyCount() {
        return excluded.stream().filter(e -> e.reason().isAnomaly()).count();
    }
}
