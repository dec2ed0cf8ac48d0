package com.aiusage.attribution.facts;

import com.aiusage.attribution.pipeline.AnomalyCategory;
import com.aiusage.attribution.pipeline.PipelineException;

/**
 * Storage contention on a fact partition that outlived the merge retries.
 */
public class MergeConflictException extends PipelineException {

    public MergeConflictException(String message) {
        super(message);
    }

    public MergeConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public AnomalyCategory getCategory() {
        return AnomalyCategory.MERGE_CONFLICT;
    }

    @Override
    public boolean isRunFatal() {
        return true;
    }
}
