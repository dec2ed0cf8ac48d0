package com.aiusage.attribution.adapters;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Normalizers indexed by the source id they handle.
 */
public class SourceNormalizerRegistry {

    private final Map<String, SourceNormalizer> bySourceId = new TreeMap<>();

    public SourceNormalizerRegistry(List<SourceNormalizer> normalizers) {
        for (SourceNormalizer normalizer : normalizers) {
            SourceNormalizer previous = bySourceId.put(normalizer.getSourceId(), normalizer);
            if (previous != null) {
                throw new IllegalStateException("Two normalizers registered for source " + normalizer.getSourceId()
                        + ": " + previous.getClass().getSimpleName() + ", " + normalizer.getClass().getSimpleName());
            }
        }
    }

    public Optional<SourceNormalizer> find(String sourceId) {
        return Optional.ofNullable(bySourceId.get(sourceId));
    }

    public SortedSet<String> sourceIds() {
        return new TreeSet<>(bySourceId.keySet());
    }
}
