package com.aiusage.attribution.facts;

import java.time.LocalDate;

/**
 * Facts removed by a backfill of one source over a date range.
 */
public record BackfillOutcome(String sourceId, LocalDate from, LocalDate to, int usageDeleted, int costDeleted) {
}
