package com.aiusage.attribution.facts;

import com.aiusage.attribution.domain.model.AttributedFact;
import com.aiusage.attribution.domain.model.ClassifiedRecord;
import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.CostMode;
import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.FactNaturalKey;
import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import com.aiusage.attribution.domain.model.UsageFact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;

/**
 * Turns classified, non-cumulative records into fact drafts keyed by natural key.
 *
 * ASSEMBLY RULES:
 * - Records carrying a diagnostic produce no facts
 * - Exact duplicate records are collapsed to one
 * - An organization-wide aggregate is dropped when the same source reports a
 *   breakdown for the same bucket
 * - cost_minor_units becomes a cost fact according to the source's cost mode;
 *   the remaining metrics become a usage fact
 * - Distinct records colliding on a natural key are summed
 */
@Component
@Slf4j
public class FactAssembler {

    public AssemblyResult assemble(String runId, List<ClassifiedRecord> records, CostMode costMode) {
        int unparseable = 0;
        int duplicates = 0;
        List<ClassifiedRecord> distinct = new ArrayList<>();
        Set<RawRecord.ContentKey> seen = new HashSet<>();
        for (ClassifiedRecord classified : records) {
            if (classified.record().isUnparseable()) {
                unparseable++;
            } else if (!seen.add(classified.record().contentKey())) {
                duplicates++;
            } else {
                distinct.add(classified);
            }
        }

        Set<BucketKey> brokenDown = distinct.stream()
                .map(ClassifiedRecord::record)
                .filter(record -> !record.isOrganizationAggregate())
                .map(BucketKey::of)
                .collect(Collectors.toSet());
        List<ClassifiedRecord> retained = new ArrayList<>();
        int suppressed = 0;
        for (ClassifiedRecord classified : distinct) {
            RawRecord record = classified.record();
            if (record.isOrganizationAggregate() && brokenDown.contains(BucketKey.of(record))) {
                suppressed++;
                log.debug("Suppressing organization aggregate of {} for bucket {}", record.sourceId(), record.bucketStart());
            } else {
                retained.add(classified);
            }
        }

        Map<FactNaturalKey, UsageFact> usage = new LinkedHashMap<>();
        Map<FactNaturalKey, CostFact> cost = new LinkedHashMap<>();
        int collisions = 0;
        int costIgnored = 0;
        for (ClassifiedRecord classified : retained) {
            FactNaturalKey key = naturalKey(classified);
            Map<String, BigDecimal> metrics = new TreeMap<>(classified.record().metricFields());
            BigDecimal amount = metrics.remove(Metrics.COST_MINOR_UNITS);

            if (amount != null) {
                if (costMode == CostMode.NONE) {
                    costIgnored++;
                } else if (mergeInto(cost, key, costFact(runId, key, classified, amount, costMode), FactAssembler::addCost)) {
                    collisions++;
                }
            }
            if (!metrics.isEmpty() && mergeInto(usage, key, usageFact(runId, key, classified, metrics), FactAssembler::addUsage)) {
                collisions++;
            }
        }

        FactBatch batch = new FactBatch(new ArrayList<>(usage.values()), new ArrayList<>(cost.values()), List.of());
        return new AssemblyResult(batch, unparseable, duplicates, suppressed, collisions, costIgnored);
    }

    public static LocalDate factDate(RawRecord record) {
        return LocalDate.ofInstant(record.bucketEnd().minusNanos(1), ZoneOffset.UTC);
    }

    private static FactNaturalKey naturalKey(ClassifiedRecord classified) {
        RawRecord record = classified.record();
        return new FactNaturalKey(
                factDate(record),
                record.sourceId(),
                classified.identity().canonicalUserId(),
                classified.platform(),
                Dimensions.discriminator(record.dimensions()));
    }

    private static UsageFact usageFact(String runId, FactNaturalKey key, ClassifiedRecord classified,
                                       Map<String, BigDecimal> metrics) {
        return UsageFact.builder()
                .factDate(key.factDate())
                .sourceId(key.sourceId())
                .canonicalUserId(key.canonicalUserId())
                .platformCategory(key.platformCategory())
                .dimensionDiscriminator(key.dimensionDiscriminator())
                .bucketStart(classified.record().bucketStart())
                .bucketEnd(classified.record().bucketEnd())
                .attributionMethod(classified.identity().method())
                .attributionConfidence(classified.identity().confidence())
                .classificationConfidence(classified.classificationConfidence())
                .runId(runId)
                .metrics(metrics)
                .build();
    }

    private static CostFact costFact(String runId, FactNaturalKey key, ClassifiedRecord classified,
                                     BigDecimal amount, CostMode costMode) {
        return CostFact.builder()
                .factDate(key.factDate())
                .sourceId(key.sourceId())
                .canonicalUserId(key.canonicalUserId())
                .platformCategory(key.platformCategory())
                .dimensionDiscriminator(key.dimensionDiscriminator())
                .bucketStart(classified.record().bucketStart())
                .bucketEnd(classified.record().bucketEnd())
                .attributionMethod(classified.identity().method())
                .attributionConfidence(classified.identity().confidence())
                .classificationConfidence(classified.classificationConfidence())
                .runId(runId)
                .amountMinorUnits(amount)
                .currency(classified.record().dimension(Dimensions.CURRENCY).orElse("USD"))
                .estimated(costMode == CostMode.ESTIMATED)
                .reconciliationStatus(ReconciliationStatus.PENDING)
                .build();
    }

    /**
     * @return true when the draft collided with an existing one and was summed into it
     */
    private static <F extends AttributedFact> boolean mergeInto(
            Map<FactNaturalKey, F> drafts, FactNaturalKey key, F draft, BiConsumer<F, F> addValue) {
        F existing = drafts.putIfAbsent(key, draft);
        if (existing == null) {
            return false;
        }
        addValue.accept(existing, draft);
        existing.setBucketStart(min(existing.getBucketStart(), draft.getBucketStart()));
        existing.setBucketEnd(max(existing.getBucketEnd(), draft.getBucketEnd()));
        existing.setAttributionConfidence(Math.min(existing.getAttributionConfidence(), draft.getAttributionConfidence()));
        existing.setClassificationConfidence(
                Math.min(existing.getClassificationConfidence(), draft.getClassificationConfidence()));
        return true;
    }

    private static void addUsage(UsageFact into, UsageFact addition) {
        into.setMetrics(Metrics.sum(into.getMetrics(), addition.getMetrics()));
    }

    private static void addCost(CostFact into, CostFact addition) {
        into.setAmountMinorUnits(into.getAmountMinorUnits().add(addition.getAmountMinorUnits()));
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static Instant max(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private record BucketKey(String sourceId, Instant start, Instant end) {
        static BucketKey of(RawRecord record) {
            return new BucketKey(record.sourceId(), record.bucketStart(), record.bucketEnd());
        }
    }
}
