package com.aiusage.attribution.facts;

import com.aiusage.attribution.domain.model.AttributedFact;
import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import com.aiusage.attribution.domain.model.UsageFact;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Facts and checkpoints merged together in one transaction.
 */
public record FactBatch(
        List<UsageFact> usageFacts,
        List<CostFact> costFacts,
        List<CumulativeCheckpoint> checkpoints
) {

    public FactBatch {
        usageFacts = List.copyOf(usageFacts);
        costFacts = List.copyOf(costFacts);
        checkpoints = List.copyOf(checkpoints);
    }

    public static FactBatch empty() {
        return new FactBatch(List.of(), List.of(), List.of());
    }

    public FactBatch withCheckpoints(List<CumulativeCheckpoint> replacement) {
        return new FactBatch(usageFacts, costFacts, replacement);
    }

    public boolean isEmpty() {
        return usageFacts.isEmpty() && costFacts.isEmpty() && checkpoints.isEmpty();
    }

    /**
     * Partitions (fact date, source) the batch writes to, in lock order.
     */
    public SortedSet<String> partitions() {
        SortedSet<String> partitions = new TreeSet<>();
        Stream.concat(usageFacts.stream(), costFacts.stream())
                .map(AttributedFact::naturalKey)
                .forEach(key -> partitions.add(key.partition()));
        checkpoints.forEach(checkpoint -> partitions.add(
                LocalDate.ofInstant(checkpoint.getObservedAt().minusNanos(1), ZoneOffset.UTC) + "/" + checkpoint.getSourceId()));
        return partitions;
    }
}
