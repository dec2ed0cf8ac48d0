package com.aiusage.attribution.normalization;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * A billing cycle closed between two observations.
 *
 * @param closedCycleStart start of the cycle that closed
 * @param closedAt         last observation of the closed cycle
 * @param closingValues    cumulative values at that observation
 * @param newCycleStart    start of the new cycle; for inferred rollovers the last observation
 * @param openedAt         first observation of the new cycle
 * @param inferred         true when detected from a decrease rather than a declared cycle start
 */
public record CycleBoundaryEvent(
        String entityKey,
        Instant closedCycleStart,
        Instant closedAt,
        Map<String, BigDecimal> closingValues,
        Instant newCycleStart,
        Instant openedAt,
        boolean inferred
) {
}
