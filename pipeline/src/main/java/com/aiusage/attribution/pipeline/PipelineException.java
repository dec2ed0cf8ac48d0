package com.aiusage.attribution.pipeline;

/**
 * Base of the pipeline's domain exceptions.
 */
public abstract class PipelineException extends RuntimeException {

    protected PipelineException(String message) {
        super(message);
    }

    protected PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract AnomalyCategory getCategory();

    /**
     * Whether the exception aborts the whole run rather than a single source.
     */
    public abstract boolean isRunFatal();
}
