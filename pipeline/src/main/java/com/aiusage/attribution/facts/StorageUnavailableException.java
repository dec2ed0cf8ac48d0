package com.aiusage.attribution.facts;

import com.aiusage.attribution.pipeline.AnomalyCategory;
import com.aiusage.attribution.pipeline.PipelineException;

/**
 * The fact store cannot be reached. Aborts the run.
 */
public class StorageUnavailableException extends PipelineException {

    public StorageUnavailableException(String message, Throwable cause) {
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
