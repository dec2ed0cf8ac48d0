package com.aiusage.attribution.facts;

import com.aiusage.attribution.domain.model.AttributedFact;
import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import com.aiusage.attribution.domain.model.FactRevision;
import com.aiusage.attribution.domain.model.RawPayloadArchive;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import com.aiusage.attribution.domain.model.UsageFact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.retry.support.RetryTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * The only component that writes facts.
 *
 * MERGE SEMANTICS (per natural key):
 * - absent: insert
 * - equal value: no-op, so reruns over unchanged input leave storage untouched
 * - different value: replace, log the prior value and write a FactRevision
 *
 * CONCURRENCY:
 * Every write runs under the partition locks of the batch plus one storage
 * transaction. Storage contention (ConcurrencyFailureException, lock timeouts) is
 * retried with exponential backoff through a Spring Retry template and becomes a
 * run-fatal MergeConflictException once the attempts are exhausted. An unreachable
 * store is run-fatal immediately. Constraint violations are not retried.
 */
@Service
@Slf4j
public class FactMerger {

    private final FactStore factStore;
    private final PartitionLockRegistry lockRegistry;
    private final ObjectMapper objectMapper;
    private final int maxAttempts;
    private final RetryTemplate retryTemplate;

    public FactMerger(
            FactStore factStore,
            PartitionLockRegistry lockRegistry,
            ObjectMapper objectMapper,
            @Value("${attribution.merge.max-attempts:3}") int maxAttempts,
            @Value("${attribution.merge.initial-backoff:500ms}") Duration initialBackoff) {
        this.factStore = factStore;
        this.lockRegistry = lockRegistry;
        this.objectMapper = objectMapper;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryTemplate = contentionRetry(this.maxAttempts, initialBackoff);
    }

    static RetryTemplate contentionRetry(int maxAttempts, Duration initialBackoff) {
        RetryTemplateBuilder builder = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .retryOn(List.of(ConcurrencyFailureException.class, MergeConflictException.class));
        if (initialBackoff.toMillis() < 1) {
            builder.noBackoff();
        } else {
            builder.exponentialBackoff(initialBackoff.toMillis(), 2.0, initialBackoff.toMillis() * 16);
        }
        return builder.build();
    }

    public MergeOutcome upsert(String runId, FactBatch batch) {
        if (batch.isEmpty()) {
            return MergeOutcome.EMPTY;
        }
        int[] attempts = new int[1];
        MergeOutcome outcome = withRetry("upsert", attempts, () -> lockRegistry.withLocks(batch.partitions(),
                () -> factStore.inTransaction(() -> mergeBatch(runId, batch))));
        log.info("Merged run {}: {} inserted, {} replaced, {} unchanged, {} checkpoint(s)",
                runId, outcome.inserted(), outcome.replaced(), outcome.unchanged(), outcome.checkpointsWritten());
        return outcome.withAttempts(attempts[0]);
    }

    /**
     * Archive raw payloads once per run, source and payload digest.
     */
    public int archivePayloads(String runId, String sourceId, List<RawRecord> records) {
        int[] attempts = new int[1];
        return withRetry("archive", attempts, () -> factStore.inTransaction(() -> {
            Set<String> written = new HashSet<>();
            for (RawRecord record : records) {
                if (record.rawPayload() == null) {
                    continue;
                }
                String digest = sha256(record.rawPayload());
                if (!written.add(digest) || factStore.archiveExists(runId, sourceId, digest)) {
                    continue;
                }
                factStore.saveArchive(RawPayloadArchive.builder()
                        .runId(runId)
                        .sourceId(sourceId)
                        .bucketStart(record.bucketStart())
                        .bucketEnd(record.bucketEnd())
                        .payloadSha256(digest)
                        .payload(record.rawPayload())
                        .diagnostic(record.diagnostic())
                        .build());
            }
            return written.size();
        }));
    }

    /**
     * Set the advisory reconciliation status of stored cost facts. Values are not touched.
     */
    public int annotateReconciliation(Collection<CostFact> facts, ReconciliationStatus status) {
        List<Long> ids = facts.stream()
                .filter(fact -> fact.getId() != null && fact.getReconciliationStatus() != status)
                .map(CostFact::getId)
                .toList();
        if (ids.isEmpty()) {
            return 0;
        }
        int[] attempts = new int[1];
        int updated = withRetry("annotate", attempts,
                () -> factStore.inTransaction(() -> factStore.updateReconciliationStatus(ids, status)));
        log.info("Marked {} cost fact(s) as {}", updated, status);
        return updated;
    }

    /**
     * Delete every fact of a source in a date range so the range can be re-ingested.
     * Each deleted row is logged and kept as a revision.
     */
    public BackfillOutcome backfill(String runId, String sourceId, LocalDate from, LocalDate to, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("backfill requires a reason");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("backfill range end " + to + " precedes start " + from);
        }
        SortedSet<String> partitions = new TreeSet<>();
        from.datesUntil(to.plusDays(1)).forEach(day -> partitions.add(day + "/" + sourceId));

        int[] attempts = new int[1];
        BackfillOutcome outcome = withRetry("backfill", attempts, () -> lockRegistry.withLocks(partitions,
                () -> factStore.inTransaction(() -> {
                    List<UsageFact> usage = factStore.findUsageFacts(sourceId, from, to);
                    for (UsageFact fact : usage) {
                        recordRemoval(runId, fact, reason);
                        factStore.deleteUsage(fact);
                    }
                    List<CostFact> cost = factStore.findCostFacts(sourceId, from, to);
                    for (CostFact fact : cost) {
                        recordRemoval(runId, fact, reason);
                        factStore.deleteCost(fact);
                    }
                    return new BackfillOutcome(sourceId, from, to, usage.size(), cost.size());
                })));
        log.warn("Backfill of {} {}..{} removed {} usage and {} cost fact(s): {}",
                sourceId, from, to, outcome.usageDeleted(), outcome.costDeleted(), reason);
        return outcome;
    }

    private MergeOutcome mergeBatch(String runId, FactBatch batch) {
        int inserted = 0;
        int replaced = 0;
        int unchanged = 0;

        for (UsageFact draft : batch.usageFacts()) {
            var existing = factStore.findUsage(draft.naturalKey());
            if (existing.isEmpty()) {
                factStore.saveUsage(draft.toBuilder().id(null).runId(runId).build());
                inserted++;
            } else if (existing.get().sameValueAs(draft)) {
                unchanged++;
            } else {
                UsageFact stored = existing.get();
                String prior = toJson(stored);
                stored.copyValueFrom(draft);
                stored.setRunId(runId);
                factStore.saveUsage(stored);
                recordReplacement(runId, stored, prior);
                replaced++;
            }
        }

        for (CostFact draft : batch.costFacts()) {
            var existing = factStore.findCost(draft.naturalKey());
            if (existing.isEmpty()) {
                factStore.saveCost(draft.toBuilder().id(null).runId(runId).build());
                inserted++;
            } else if (existing.get().sameValueAs(draft)) {
                unchanged++;
            } else {
                CostFact stored = existing.get();
                String prior = toJson(stored);
                stored.copyValueFrom(draft);
                stored.setRunId(runId);
                factStore.saveCost(stored);
                recordReplacement(runId, stored, prior);
                replaced++;
            }
        }

        for (CumulativeCheckpoint draft : batch.checkpoints()) {
            CumulativeCheckpoint checkpoint = factStore
                    .findCheckpoint(draft.getSourceId(), draft.getEntityKey(), draft.getObservedAt())
                    .orElseGet(() -> CumulativeCheckpoint.builder()
                            .sourceId(draft.getSourceId())
                            .entityKey(draft.getEntityKey())
                            .observedAt(draft.getObservedAt())
                            .build());
            checkpoint.setBillingCycleStart(draft.getBillingCycleStart());
            checkpoint.setMetricValues(draft.getMetricValues());
            checkpoint.setRunId(runId);
            factStore.saveCheckpoint(checkpoint);
        }

        return new MergeOutcome(inserted, replaced, unchanged, batch.checkpoints().size(), 1);
    }

    private void recordReplacement(String runId, AttributedFact stored, String prior) {
        log.info("Replaced {} fact {}; prior value {}", stored.factType(), stored.naturalKey(), prior);
        factStore.saveRevision(FactRevision.builder()
                .factType(stored.factType())
                .naturalKey(stored.naturalKey().toString())
                .reason(FactRevision.RevisionReason.REPLACED)
                .priorValue(prior)
                .newValue(toJson(stored))
                .runId(runId)
                .build());
    }

    private void recordRemoval(String runId, AttributedFact fact, String reason) {
        String prior = toJson(fact);
        log.warn("Backfill removing {} fact {}; prior value {}", fact.factType(), fact.naturalKey(), prior);
        factStore.saveRevision(FactRevision.builder()
                .factType(fact.factType())
                .naturalKey(fact.naturalKey().toString())
                .reason(FactRevision.RevisionReason.BACKFILL)
                .priorValue(prior)
                .note(reason)
                .runId(runId)
                .build());
    }

    private <T> T withRetry(String operation, int[] attempts, Supplier<T> work) {
        try {
            return retryTemplate.execute(context -> {
                attempts[0] = context.getRetryCount() + 1;
                if (context.getLastThrowable() != null) {
                    log.warn("Storage contention during {} (attempt {}/{}): {}",
                            operation, attempts[0], maxAttempts, context.getLastThrowable().getMessage());
                }
                return work.get();
            });
        } catch (ConcurrencyFailureException | MergeConflictException e) {
            log.error("Giving up {} after {} attempt(s): {}", operation, attempts[0], e.getMessage());
            throw new MergeConflictException(
                    operation + " failed after " + attempts[0] + " attempt(s): " + e.getMessage(), e);
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            log.error("Fact store unavailable during {}: {}", operation, e.getMessage());
            throw new StorageUnavailableException("Fact store unavailable during " + operation, e);
        }
    }

    private String toJson(AttributedFact fact) {
        try {
            return objectMapper.writeValueAsString(fact.describe());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize fact " + fact.naturalKey(), e);
        }
    }

    private static String sha256(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
