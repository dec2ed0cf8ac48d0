package com.aiusage.attribution.reconciliation;

import java.util.List;

/**
 * Source of invoice totals to reconcile against.
 */
public interface GroundTruthProvider {

    /**
     * Totals whose period overlaps the window.
     */
    List<GroundTruthTotal> totalsFor(ReconciliationPeriod window);
}
