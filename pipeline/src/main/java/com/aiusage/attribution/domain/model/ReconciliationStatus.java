package com.aiusage.attribution.domain.model;

/**
 * Outcome of comparing aggregated cost facts with an invoice total.
 */
public enum ReconciliationStatus {
    /**
     * Not yet compared against any ground truth.
     */
    PENDING,

    /**
     * Aggregate within tolerance of the invoice.
     */
    MATCHED,

    /**
     * Aggregate outside tolerance; needs manual review.
     */
    VARIANCE_FLAGGED
}
