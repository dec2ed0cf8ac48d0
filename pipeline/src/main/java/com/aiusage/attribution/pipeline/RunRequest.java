package com.aiusage.attribution.pipeline;

import com.aiusage.attribution.ingestion.FetchWindow;

import java.util.List;
import java.util.Objects;

/**
 * Parameters of one pipeline run.
 *
 * @param backfillReason when non-null, stored facts of the window are deleted before ingesting
 */
public record RunRequest(FetchWindow window, List<String> sourceIds, boolean reconcile, String backfillReason) {

    public RunRequest {
        Objects.requireNonNull(window, "window");
        sourceIds = List.copyOf(sourceIds);
        if (sourceIds.isEmpty()) {
            throw new IllegalArgumentException("at least one source is required");
        }
        if (backfillReason != null && backfillReason.isBlank()) {
            throw new IllegalArgumentException("backfill reason must not be blank");
        }
    }

    public boolean isBackfill() {
        return backfillReason != null;
    }
}
