package com.aiusage.attribution.normalization;

import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Converts cumulative billing snapshots into per-interval deltas.
 *
 * SEQUENCE RULES (snapshots ordered by observation time = bucketEnd):
 * - Exact duplicates are dropped
 * - Same observation time with different values is an anomaly and excluded
 * - A declared cycle start earlier than the current cycle is an anomaly and excluded
 * - A later declared cycle start is a known rollover: delta = snapshot value
 * - Any metric decreasing within a cycle is an inferred rollover: delta = snapshot value
 * - Otherwise delta = max(0, current - previous) per metric
 *
 * BASELINE:
 * Without a prior baseline, the first snapshot emits its full value only when it is
 * a confirmed first observation of its cycle (bucketStart at or before the cycle
 * start). Otherwise it is held as baseline: emitting it would attribute the whole
 * month-to-date spend to one day.
 *
 * Every emitted delta is non-negative.
 */
@Component
@Slf4j
public class BillingDeltaNormalizer {

    private final BigDecimal decreaseTolerance;

    public BillingDeltaNormalizer(@Value("${attribution.billing.decrease-tolerance:0}") BigDecimal decreaseTolerance) {
        this.decreaseTolerance = decreaseTolerance.abs();
    }

    public DeltaResult toDeltas(List<RawRecord> snapshots) {
        return toDeltas(snapshots, null);
    }

    public DeltaResult toDeltas(List<RawRecord> snapshots, CumulativeBaseline prior) {
        List<RawRecord> ordered = snapshots.stream()
                .sorted(Comparator.comparing(RawRecord::observedAt).thenComparing(RawRecord::bucketStart))
                .toList();
        ordered.forEach(BillingDeltaNormalizer::requireCumulative);

        Sequence sequence = new Sequence(prior);
        for (RawRecord snapshot : ordered) {
            sequence.accept(snapshot);
        }
        return sequence.result();
    }

    /**
     * Key identifying one billing entity: source, identity hints and discriminating dimensions.
     */
    public static String entityKey(RawRecord record) {
        String hints = record.identityHints().entrySet().stream()
                .map(e -> e.getKey().getWireName() + "=" + e.getValue())
                .collect(Collectors.joining(","));
        return record.sourceId() + "|" + hints + "|" + Dimensions.discriminator(record.dimensions());
    }

    private static void requireCumulative(RawRecord record) {
        if (!record.cumulative()) {
            throw new IllegalArgumentException("delta normalization expects cumulative snapshots, got " + record);
        }
    }

    private final class Sequence {

        private final List<RawRecord> deltas = new ArrayList<>();
        private final List<CycleBoundaryEvent> events = new ArrayList<>();
        private final List<ExcludedSnapshot> excluded = new ArrayList<>();
        private final List<RawRecord> held = new ArrayList<>();
        private final List<CumulativeBaseline> checkpoints = new ArrayList<>();

        private String entityKey;
        private Instant cycleStart;
        private Instant lastObservedAt;
        private Map<String, BigDecimal> lastValues;
        private Map<String, BigDecimal> lastSnapshotValues;

        Sequence(CumulativeBaseline prior) {
            if (prior != null) {
                entityKey = prior.entityKey();
                cycleStart = prior.billingCycleStart();
                lastObservedAt = prior.observedAt();
                lastValues = new TreeMap<>(prior.values());
                lastSnapshotValues = prior.values();
            }
        }

        void accept(RawRecord snapshot) {
            String key = entityKey(snapshot);
            if (entityKey == null) {
                entityKey = key;
            } else if (!entityKey.equals(key)) {
                throw new IllegalArgumentException("snapshots of different entities: " + entityKey + " / " + key);
            }

            Map<String, BigDecimal> values = snapshot.metricFields();
            if (values.values().stream().anyMatch(v -> v.signum() < 0)) {
                exclude(snapshot, ExcludedSnapshot.Reason.NEGATIVE_VALUE, "negative cumulative value " + values);
                return;
            }

            if (lastValues != null && !snapshot.observedAt().isAfter(lastObservedAt)) {
                if (snapshot.observedAt().equals(lastObservedAt) && Metrics.sameValues(values, lastSnapshotValues)) {
                    excluded.add(new ExcludedSnapshot(snapshot, ExcludedSnapshot.Reason.DUPLICATE, "duplicate observation"));
                } else {
                    exclude(snapshot, ExcludedSnapshot.Reason.CONFLICTING_OBSERVATION,
                            "observation at " + snapshot.observedAt() + " conflicts with baseline at " + lastObservedAt);
                }
                return;
            }

            if (lastValues == null) {
                acceptFirst(snapshot);
            } else if (snapshot.billingCycleStart().isBefore(cycleStart)) {
                exclude(snapshot, ExcludedSnapshot.Reason.CYCLE_REGRESSION,
                        "cycle start " + snapshot.billingCycleStart() + " precedes current cycle " + cycleStart);
                return;
            } else if (snapshot.billingCycleStart().isAfter(cycleStart)) {
                events.add(new CycleBoundaryEvent(entityKey, cycleStart, lastObservedAt, Map.copyOf(lastValues),
                        snapshot.billingCycleStart(), snapshot.observedAt(), false));
                log.info("Billing cycle rollover for {}: {} -> {}", entityKey, cycleStart, snapshot.billingCycleStart());
                cycleStart = snapshot.billingCycleStart();
                Instant start = lastObservedAt.isAfter(cycleStart) ? lastObservedAt : cycleStart;
                emit(snapshot, start, values);
                lastValues = new TreeMap<>(values);
            } else if (decreased(values)) {
                events.add(new CycleBoundaryEvent(entityKey, cycleStart, lastObservedAt, Map.copyOf(lastValues),
                        lastObservedAt, snapshot.observedAt(), true));
                log.info("Inferred billing cycle rollover for {} at {}: cumulative value decreased", entityKey, lastObservedAt);
                emit(snapshot, lastObservedAt, values);
                lastValues = new TreeMap<>(values);
            } else {
                emit(snapshot, lastObservedAt, difference(values));
                lastValues.putAll(values);
            }

            lastObservedAt = snapshot.observedAt();
            lastSnapshotValues = values;
            checkpoints.add(new CumulativeBaseline(entityKey, cycleStart, lastObservedAt, lastValues));
        }

        private void acceptFirst(RawRecord snapshot) {
            cycleStart = snapshot.billingCycleStart();
            lastValues = new TreeMap<>(snapshot.metricFields());
            if (!snapshot.bucketStart().isAfter(cycleStart)) {
                emit(snapshot, cycleStart, snapshot.metricFields());
            } else {
                held.add(snapshot);
                log.warn("Holding first snapshot of {} at {} as baseline: cycle started {} before its bucket",
                        entityKey, snapshot.observedAt(), cycleStart);
            }
        }

        private boolean decreased(Map<String, BigDecimal> values) {
            return values.entrySet().stream().anyMatch(e -> {
                BigDecimal previous = lastValues.get(e.getKey());
                return previous != null && previous.subtract(e.getValue()).compareTo(decreaseTolerance) > 0;
            });
        }

        private Map<String, BigDecimal> difference(Map<String, BigDecimal> values) {
            Map<String, BigDecimal> delta = new TreeMap<>();
            values.forEach((metric, current) -> {
                BigDecimal previous = lastValues.get(metric);
                if (previous == null) {
                    log.debug("Metric {} first seen mid-cycle for {}; no delta until next observation", metric, entityKey);
                    return;
                }
                delta.put(metric, current.subtract(previous).max(BigDecimal.ZERO));
            });
            return delta;
        }

        private void emit(RawRecord snapshot, Instant start, Map<String, BigDecimal> values) {
            if (!start.isBefore(snapshot.observedAt())) {
                exclude(snapshot, ExcludedSnapshot.Reason.EMPTY_INTERVAL,
                        "empty delta interval [" + start + ", " + snapshot.observedAt() + ")");
                return;
            }
            deltas.add(snapshot.toBuilder()
                    .bucketStart(start)
                    .bucketEnd(snapshot.observedAt())
                    .metricFields(values)
                    .cumulative(false)
                    .billingCycleStart(cycleStart)
                    .build());
        }

        private void exclude(RawRecord snapshot, ExcludedSnapshot.Reason reason, String detail) {
            log.warn("Cycle boundary anomaly for {}: {}", entityKey, detail);
            excluded.add(new ExcludedSnapshot(snapshot, reason, detail));
        }

        DeltaResult result() {
            return new DeltaResult(List.copyOf(deltas), List.copyOf(events), List.copyOf(excluded),
                    List.copyOf(held), List.copyOf(checkpoints));
        }
    }
}
