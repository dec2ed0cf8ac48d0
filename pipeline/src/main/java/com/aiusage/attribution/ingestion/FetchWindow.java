package com.aiusage.attribution.ingestion;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Inclusive range of UTC calendar days a run covers.
 */
public record FetchWindow(LocalDate from, LocalDate to) {

    public FetchWindow {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("window end " + to + " precedes start " + from);
        }
    }

    public static FetchWindow ofDay(LocalDate day) {
        return new FetchWindow(day, day);
    }

    public Instant startInstant() {
        return from.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    /**
     * Exclusive end: midnight after the last day.
     */
    public Instant endInstant() {
        return to.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public boolean contains(LocalDate day) {
        return !day.isBefore(from) && !day.isAfter(to);
    }

    /**
     * Whether the half-open range overlaps this window.
     */
    public boolean overlaps(Instant start, Instant end) {
        return start.isBefore(endInstant()) && end.isAfter(startInstant());
    }

    @Override
    public String toString() {
        return from + ".." + to;
    }
}
