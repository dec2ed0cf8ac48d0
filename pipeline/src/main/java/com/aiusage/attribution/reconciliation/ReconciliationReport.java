package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.domain.model.ReconciliationStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Comparison of aggregated cost facts with one invoice total. All amounts in minor units.
 *
 * @param netVariance      aggregated minus ground truth (signed)
 * @param varianceAbsolute magnitude of the net variance
 * @param variancePercent  magnitude relative to ground truth, two decimals
 * @param missingData      ground truth is positive but no matching cost was aggregated
 * @param bySource         aggregated amount per source
 */
public record ReconciliationReport(
        String reference,
        ReconciliationPeriod period,
        String currency,
        BigDecimal aggregatedMinorUnits,
        BigDecimal groundTruthMinorUnits,
        BigDecimal netVariance,
        BigDecimal varianceAbsolute,
        BigDecimal variancePercent,
        ReconciliationStatus status,
        boolean missingData,
        Map<String, BigDecimal> bySource,
        int factCount,
        List<String> notes
) {

    public boolean isFlagged() {
        return status == ReconciliationStatus.VARIANCE_FLAGGED;
    }
}
