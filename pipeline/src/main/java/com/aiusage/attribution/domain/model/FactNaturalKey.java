package com.aiusage.attribution.domain.model;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.Objects;

/**
 * Natural key shared by usage and cost facts. Upserts are keyed on it.
 */
public record FactNaturalKey(
        LocalDate factDate,
        String sourceId,
        String canonicalUserId,
        PlatformCategory platformCategory,
        String dimensionDiscriminator
) implements Comparable<FactNaturalKey> {

    private static final Comparator<FactNaturalKey> ORDER = Comparator
            .comparing(FactNaturalKey::factDate)
            .thenComparing(FactNaturalKey::sourceId)
            .thenComparing(FactNaturalKey::canonicalUserId)
            .thenComparing(FactNaturalKey::platformCategory)
            .thenComparing(FactNaturalKey::dimensionDiscriminator);

    public FactNaturalKey {
        Objects.requireNonNull(factDate, "factDate");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(canonicalUserId, "canonicalUserId");
        Objects.requireNonNull(platformCategory, "platformCategory");
        Objects.requireNonNull(dimensionDiscriminator, "dimensionDiscriminator");
    }

    /**
     * Storage partition the key belongs to; merges lock at this granularity.
     */
    public String partition() {
        return factDate + "/" + sourceId;
    }

    @Override
    public int compareTo(FactNaturalKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return factDate + "|" + sourceId + "|" + canonicalUserId + "|"
                + platformCategory.getWireName() + "|" + dimensionDiscriminator;
    }
}
