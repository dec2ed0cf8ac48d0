package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.PlatformCategory;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;

/**
 * An invoice total entered by finance.
 *
 * @param sourceIds sources whose cost facts the invoice covers; empty means all
 * @param platform  platform the invoice covers; null means all
 */
public record GroundTruthTotal(
        String reference,
        ReconciliationPeriod period,
        BigDecimal amountMinorUnits,
        String currency,
        Set<String> sourceIds,
        PlatformCategory platform
) {

    public GroundTruthTotal {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(amountMinorUnits, "amountMinorUnits");
        currency = currency == null ? "USD" : currency;
        sourceIds = sourceIds == null ? Set.of() : Set.copyOf(sourceIds);
    }

    public boolean covers(CostFact fact) {
        return (sourceIds.isEmpty() || sourceIds.contains(fact.getSourceId()))
                && (platform == null || platform == fact.getPlatformCategory());
    }
}
