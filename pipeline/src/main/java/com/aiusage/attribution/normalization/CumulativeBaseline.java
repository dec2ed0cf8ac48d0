package com.aiusage.attribution.normalization;

import com.aiusage.attribution.domain.model.CumulativeCheckpoint;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cumulative state of one billing entity at an observation time.
 */
public record CumulativeBaseline(
        String entityKey,
        Instant billingCycleStart,
        Instant observedAt,
        Map<String, BigDecimal> values
) {

    public CumulativeBaseline {
        values = Map.copyOf(new TreeMap<>(values));
    }

    public static CumulativeBaseline of(CumulativeCheckpoint checkpoint) {
        return new CumulativeBaseline(
                checkpoint.getEntityKey(),
                checkpoint.getBillingCycleStart(),
                checkpoint.getObservedAt(),
                checkpoint.getMetricValues());
    }
}
