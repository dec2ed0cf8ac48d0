package com.aiusage.attribution.reconciliation;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive range of fact dates an invoice covers.
 */
public record ReconciliationPeriod(LocalDate start, LocalDate end) {

    public ReconciliationPeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("period end " + end + " precedes start " + start);
        }
    }

    public boolean overlaps(ReconciliationPeriod other) {
        return !start.isAfter(other.end) && !end.isBefore(other.start);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
