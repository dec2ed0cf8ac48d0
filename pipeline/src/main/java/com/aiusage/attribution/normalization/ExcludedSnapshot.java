package com.aiusage.attribution.normalization;

import com.aiusage.attribution.domain.model.RawRecord;

/**
 * A cumulative snapshot that produced no delta and did not advance the baseline.
 */
public record ExcludedSnapshot(RawRecord snapshot, Reason reason, String detail) {

    public enum Reason {
        /**
         * Same observation time and values as an accepted snapshot.
         */
        DUPLICATE(false),

        /**
         * Same or earlier observation time as the baseline, with different values.
         */
        CONFLICTING_OBSERVATION(true),

        /**
         * Declares a cycle start earlier than the current cycle.
         */
        CYCLE_REGRESSION(true),

        /**
         * Carries a negative cumulative value.
         */
        NEGATIVE_VALUE(true),

        /**
         * The delta interval would be empty.
         */
        EMPTY_INTERVAL(true);

        private final boolean anomaly;

        Reason(boolean anomaly) {
            this.anomaly = anomaly;
        }

        public boolean isAnomaly() {
            return anomaly;
        }
    }
}
