package com.aiusage.attribution.ingestion;

import com.aiusage.attribution.pipeline.AnomalyCategory;
import com.aiusage.attribution.pipeline.PipelineException;

/**
 * Terminal failure to obtain a source's payloads. Fails that source only.
 */
public class SourceFetchException extends PipelineException {

    private final String sourceId;

    public SourceFetchException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public SourceFetchException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }

    @Override
    public AnomalyCategory getCategory() {
        return AnomalyCategory.SOURCE_FETCH_FAILED;
    }

    @Override
    public boolean isRunFatal() {
        return false;
    }
}
