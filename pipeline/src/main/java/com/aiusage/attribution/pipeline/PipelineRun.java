package com.aiusage.attribution.pipeline;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on one execution. Cancellation takes effect between stages: sources
 * already merged stay committed and a rerun converges on the same facts.
 */
public class PipelineRun {

    private final String runId;
    private final RunRequest request;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public PipelineRun(String runId, RunRequest request) {
        this.runId = runId;
        this.request = request;
    }

    public static PipelineRun start(RunRequest request) {
        return new PipelineRun(UUID.randomUUID().toString(), request);
    }

    public String getRunId() {
        return runId;
    }

    public RunRequest getRequest() {
        return request;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
