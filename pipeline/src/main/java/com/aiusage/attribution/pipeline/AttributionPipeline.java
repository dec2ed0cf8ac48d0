package com.aiusage.attribution.pipeline;

import com.aiusage.attribution.adapters.SourceNormalizer;
import com.aiusage.attribution.adapters.SourceNormalizerRegistry;
import com.aiusage.attribution.classification.Classification;
import com.aiusage.attribution.classification.PlatformClassifier;
import com.aiusage.attribution.config.AttributionProperties;
import com.aiusage.attribution.domain.model.ClassifiedRecord;
import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import com.aiusage.attribution.facts.AssemblyResult;
import com.aiusage.attribution.facts.FactAssembler;
import com.aiusage.attribution.facts.FactBatch;
import com.aiusage.attribution.facts.FactMerger;
import com.aiusage.attribution.facts.FactStore;
import com.aiusage.attribution.facts.StorageUnavailableException;
import com.aiusage.attribution.identity.AttributionSummary;
import com.aiusage.attribution.identity.IdentityMappingProvider;
import com.aiusage.attribution.identity.IdentityMappingView;
import com.aiusage.attribution.identity.IdentityResolver;
import com.aiusage.attribution.ingestion.FetchWindow;
import com.aiusage.attribution.ingestion.SourceAdapter;
import com.aiusage.attribution.ingestion.SourceFetchException;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.aiusage.attribution.normalization.BillingDeltaNormalizer;
import com.aiusage.attribution.normalization.CumulativeBaseline;
import com.aiusage.attribution.normalization.DeltaResult;
import com.aiusage.attribution.reconciliation.ReconciliationPeriod;
import com.aiusage.attribution.reconciliation.ReconciliationReport;
import com.aiusage.attribution.reconciliation.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Runs ingestion end to end for a fetch window.
 *
 * STAGES (per source, sources prepared concurrently):
 * 1. fetch raw payloads through the source adapter
 * 2. normalize into raw records; unparseable fragments are counted and archived
 * 3. resolve identity and classify platform against one mapping snapshot per run
 * 4. turn cumulative snapshots into deltas, seeded from stored checkpoints
 * 5. assemble fact drafts
 *
 * Prepared sources are then merged one at a time in request order. A source that
 * fails is isolated: the others still merge. A run-fatal error (merge conflict,
 * storage outage) stops merging and skips every source not yet merged. Storage
 * errors in either phase count as an outage, except a batch the store rejects
 * (constraint violation), which only fails its source.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AttributionPipeline {

    private final List<SourceAdapter> sourceAdapters;
    private final SourceNormalizerRegistry sourceNormalizers;
    private final IdentityMappingProvider identityMappingProvider;
    private final IdentityResolver identityResolver;
    private final PlatformClassifier platformClassifier;
    private final BillingDeltaNormalizer billingDeltaNormalizer;
    private final FactAssembler factAssembler;
    private final FactMerger factMerger;
    private final FactStore factStore;
    private final ReconciliationService reconciliationService;
    private final AttributionProperties properties;
    private final ExecutorService pipelineExecutor;

    public RunSummary run(RunRequest request) {
        return run(PipelineRun.start(request));
    }

    public RunSummary run(PipelineRun run) {
        RunRequest request = run.getRequest();
        FetchWindow window = request.window();
        Instant startedAt = Instant.now();
        IdentityMappingView mapping = identityMappingProvider.currentView();
        log.info("Run {} started for window {} over sources {} (identity mapping {}, {} key(s))",
                run.getRunId(), window, request.sourceIds(), mapping.version(), mapping.keyCount());

        Map<String, SourceOutcome> outcomes = new LinkedHashMap<>();
        Map<String, Future<FactBatchWithRecords>> prepared = new LinkedHashMap<>();
        for (String sourceId : request.sourceIds()) {
            SourceOutcome outcome = new SourceOutcome(sourceId);
            outcomes.put(sourceId, outcome);
            if (!properties.isEnabled(sourceId)) {
                outcome.skip("source disabled in configuration");
                continue;
            }
            prepared.put(sourceId, pipelineExecutor.submit(() -> prepare(run, sourceId, mapping, outcome)));
        }

        String fatalError = null;
        for (Map.Entry<String, Future<FactBatchWithRecords>> entry : prepared.entrySet()) {
            SourceOutcome outcome = outcomes.get(entry.getKey());
            FactBatchWithRecords batch;
            try {
                batch = await(entry.getValue(), outcome);
            } catch (PipelineException e) {
                if (fatalError == null) {
                    fatalError = e.getMessage();
                    log.error("Run {} aborted while preparing {}: {}", run.getRunId(), entry.getKey(), e.getMessage(), e);
                }
                continue;
            }
            if (fatalError != null) {
                outcome.skip("run aborted: " + fatalError);
                continue;
            }
            if (run.isCancelled()) {
                outcome.skip("run cancelled");
                continue;
            }
            if (batch == null) {
                continue;
            }
            try {
                merge(run, request, outcome, batch);
            } catch (RuntimeException e) {
                PipelineException failure = asPipelineException(e);
                if (failure == null) {
                    outcome.fail(AnomalyCategory.MERGE_REJECTED, e.getMessage());
                    log.error("Merge of {} rejected: {}", entry.getKey(), e.getMessage(), e);
                    continue;
                }
                outcome.fail(failure.getCategory(), failure.getMessage());
                if (failure.isRunFatal()) {
                    fatalError = failure.getMessage();
                    log.error("Run {} aborted while merging {}: {}", run.getRunId(), entry.getKey(), failure.getMessage(), e);
                } else {
                    log.error("Merge of {} failed: {}", entry.getKey(), failure.getMessage(), e);
                }
            }
        }

        List<ReconciliationReport> reports = List.of();
        if (request.reconcile() && fatalError == null && !run.isCancelled()) {
            try {
                reports = reconciliationService.reconcile(new ReconciliationPeriod(window.from(), window.to()));
            } catch (RuntimeException e) {
                PipelineException failure = asPipelineException(e);
                if (failure != null && failure.isRunFatal()) {
                    fatalError = failure.getMessage();
                    log.error("Run {} aborted during reconciliation: {}", run.getRunId(), failure.getMessage(), e);
                } else {
                    log.warn("Reconciliation of run {} skipped: {}", run.getRunId(), e.getMessage(), e);
                }
            }
        }

        outcomes.values().forEach(SourceOutcome::complete);
        RunSummary summary = new RunSummary(run.getRunId(), window, startedAt, Instant.now(), run.isCancelled(),
                fatalError, new ArrayList<>(outcomes.values()), reports);
        log.info("Run {} finished with exit code {}: anomalies {}", run.getRunId(), summary.exitCode(), summary.anomalyTotals());
        return summary;
    }

    private void merge(PipelineRun run, RunRequest request, SourceOutcome outcome, FactBatchWithRecords batch) {
        String sourceId = outcome.getSourceId();
        outcome.recordArchive(factMerger.archivePayloads(run.getRunId(), sourceId, batch.records()));
        if (outcome.isFailed()) {
            return;
        }
        if (request.isBackfill()) {
            FetchWindow window = request.window();
            outcome.recordBackfill(factMerger.backfill(run.getRunId(), sourceId, window.from(), window.to(),
                    request.backfillReason()));
        }
        outcome.recordMerge(factMerger.upsert(run.getRunId(), batch.batch()));
    }

    /**
     * Waits for a prepared source. A failed source is marked on its outcome; a
     * run-fatal failure is rethrown once marked.
     */
    private FactBatchWithRecords await(Future<FactBatchWithRecords> future, SourceOutcome outcome) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Preparing {} failed: {}", outcome.getSourceId(), cause.getMessage(), cause);
            PipelineException failure = asPipelineException(cause);
            if (failure == null) {
                outcome.fail(AnomalyCategory.SOURCE_UNPARSEABLE, cause.getMessage());
                return null;
            }
            outcome.fail(failure.getCategory(), failure.getMessage());
            if (failure.isRunFatal()) {
                throw failure;
            }
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome.skip("interrupted");
            return null;
        }
    }

    /**
     * Maps a failure onto the pipeline's error taxonomy, or null for a failure local to one source.
     */
    private static PipelineException asPipelineException(Throwable failure) {
        if (failure instanceof PipelineException) {
            return (PipelineException) failure;
        }
        if (failure instanceof CannotCreateTransactionException
                || (failure instanceof DataAccessException && !(failure instanceof DataIntegrityViolationException))) {
            return new StorageUnavailableException("Fact store unavailable: " + failure.getMessage(), failure);
        }
        return null;
    }

    /**
     * Fetch, normalize, classify and assemble one source. Returns null when there is
     * nothing to merge or archive.
     */
    private FactBatchWithRecords prepare(PipelineRun run, String sourceId, IdentityMappingView mapping,
                                         SourceOutcome outcome) {
        FetchWindow window = run.getRequest().window();
        SourceNormalizer normalizer = sourceNormalizers.find(sourceId).orElse(null);
        if (normalizer == null) {
            outcome.fail(AnomalyCategory.SOURCE_FETCH_FAILED, "no normalizer registered for " + sourceId);
            return null;
        }
        SourceAdapter adapter = sourceAdapters.stream()
                .filter(a -> a.supports(sourceId))
                .findFirst()
                .orElse(null);
        if (adapter == null) {
            outcome.fail(AnomalyCategory.SOURCE_FETCH_FAILED, "no adapter supports " + sourceId);
            return null;
        }

        List<SourcePayload> payloads;
        try {
            payloads = adapter.fetch(sourceId, window);
        } catch (SourceFetchException e) {
            log.error("Fetching {} failed: {}", sourceId, e.getMessage());
            outcome.fail(e.getCategory(), e.getMessage());
            return null;
        }
        if (run.isCancelled()) {
            outcome.skip("run cancelled");
            return null;
        }

        List<RawRecord> records = payloads.stream()
                .flatMap(payload -> normalizer.normalize(payload).stream())
                .toList();
        List<RawRecord> parseable = new ArrayList<>();
        List<ClassifiedRecord> unparseable = new ArrayList<>();
        int outOfWindow = 0;
        for (RawRecord record : records) {
            if (record.isUnparseable()) {
                outcome.note(record.diagnostic());
                unparseable.add(new ClassifiedRecord(record, ResolvedIdentity.unresolved(), PlatformCategory.UNKNOWN,
                        0.0, Classification.FALLBACK_RULE));
            } else if (window.contains(FactAssembler.factDate(record))) {
                parseable.add(record);
            } else {
                outOfWindow++;
            }
        }
        outcome.recordNormalization(payloads.size(), records.size(), outOfWindow);
        outcome.count(AnomalyCategory.SOURCE_UNPARSEABLE, unparseable.size());
        if (!records.isEmpty() && unparseable.size() == records.size()) {
            outcome.fail(AnomalyCategory.SOURCE_UNPARSEABLE, "no payload of " + sourceId + " could be parsed");
            return new FactBatchWithRecords(records, FactBatch.empty());
        }
        if (run.isCancelled()) {
            outcome.skip("run cancelled");
            return null;
        }

        List<ClassifiedRecord> classified = parseable.stream()
                .map(record -> classify(record, mapping))
                .toList();
        outcome.recordAttribution(AttributionSummary.of(classified));

        List<ClassifiedRecord> assemblable = new ArrayList<>(unparseable);
        List<ClassifiedRecord> cumulative = new ArrayList<>();
        for (ClassifiedRecord record : classified) {
            if (record.record().cumulative()) {
                cumulative.add(record);
            } else {
                assemblable.add(record);
            }
        }
        List<CumulativeCheckpoint> checkpoints = new ArrayList<>();
        assemblable.addAll(toDeltas(sourceId, cumulative, outcome, checkpoints));

        AssemblyResult assembly = factAssembler.assemble(run.getRunId(), assemblable,
                properties.costModeFor(sourceId));
        outcome.recordAssembly(assembly);
        log.info("Prepared {}: {} payload(s), {} record(s), {} usage and {} cost fact draft(s)",
                sourceId, payloads.size(), records.size(),
                assembly.batch().usageFacts().size(), assembly.batch().costFacts().size());
        return new FactBatchWithRecords(records, assembly.batch().withCheckpoints(checkpoints));
    }

    private ClassifiedRecord classify(RawRecord record, IdentityMappingView mapping) {
        ResolvedIdentity identity = identityResolver.resolve(record, mapping);
        Classification classification = platformClassifier.classify(record, identity);
        return new ClassifiedRecord(record, identity, classification.category(),
                classification.confidence(), classification.rule());
    }

    private List<ClassifiedRecord> toDeltas(String sourceId, List<ClassifiedRecord> snapshots, SourceOutcome outcome,
                                            List<CumulativeCheckpoint> checkpoints) {
        Map<String, List<ClassifiedRecord>> byEntity = snapshots.stream()
                .collect(Collectors.groupingBy(c -> BillingDeltaNormalizer.entityKey(c.record()),
                        LinkedHashMap::new, Collectors.toList()));

        List<ClassifiedRecord> deltas = new ArrayList<>();
        for (Map.Entry<String, List<ClassifiedRecord>> entity : byEntity.entrySet()) {
            List<ClassifiedRecord> group = entity.getValue();
            Instant firstObservation = group.stream()
                    .map(c -> c.record().observedAt())
                    .min(Comparator.naturalOrder())
                    .orElseThrow();
            CumulativeBaseline prior = factStore
                    .findLatestCheckpointBefore(sourceId, entity.getKey(), firstObservation)
                    .map(CumulativeBaseline::of)
                    .orElse(null);

            DeltaResult result = billingDeltaNormalizer.toDeltas(
                    group.stream().map(ClassifiedRecord::record).toList(), prior);
            ClassifiedRecord template = group.get(0);
            result.deltas().forEach(delta -> deltas.add(template.withRecord(delta)));
            result.excluded().stream()
                    .filter(excluded -> excluded.reason().isAnomaly())
                    .forEach(excluded -> outcome.note(excluded.reason() + ": " + excluded.detail()));
            result.checkpoints().forEach(checkpoint -> checkpoints.add(CumulativeCheckpoint.builder()
                    .sourceId(sourceId)
                    .entityKey(checkpoint.entityKey())
                    .billingCycleStart(checkpoint.billingCycleStart())
                    .observedAt(checkpoint.observedAt())
                    .metricValues(checkpoint.values())
                    .build()));
            outcome.count(AnomalyCategory.CYCLE_BOUNDARY_ANOMALY, result.anomalyCount());
            outcome.count(AnomalyCategory.BASELINE_HELD, result.heldBaselines().size());
            outcome.recordBoundaryEvents(result.boundaryEvents().size());
        }
        return deltas;
    }

    private record FactBatchWithRecords(List<RawRecord> records, FactBatch batch) {
    }
}
