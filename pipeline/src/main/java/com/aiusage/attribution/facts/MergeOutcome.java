package com.aiusage.attribution.facts;

/**
 * What one merge wrote.
 *
 * @param attempts storage transactions tried; above 1 means contention was retried
 */
public record MergeOutcome(int inserted, int replaced, int unchanged, int checkpointsWritten, int attempts) {

    public static final MergeOutcome EMPTY = new MergeOutcome(0, 0, 0, 0, 0);

    MergeOutcome withAttempts(int count) {
        return new MergeOutcome(inserted, replaced, unchanged, checkpointsWritten, count);
    }
}
