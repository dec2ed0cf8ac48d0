package com.aiusage.attribution.pipeline;

import com.aiusage.attribution.adapters.SourceNormalizerRegistry;
import com.aiusage.attribution.adapters.claudeai.ClaudeAiAuditLogNormalizer;
import com.aiusage.attribution.adapters.cursor.CursorDailyUsageNormalizer;
import com.aiusage.attribution.adapters.cursor.CursorSpendNormalizer;
import com.aiusage.attribution.classification.ExplicitPlatformRule;
import com.aiusage.attribution.classification.IdentifierPatternRule;
import com.aiusage.attribution.classification.KeyMappingPlatformRule;
import com.aiusage.attribution.classification.MetricShapeRule;
import com.aiusage.attribution.classification.PlatformClassifier;
import com.aiusage.attribution.config.AttributionProperties;
import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import com.aiusage.attribution.domain.model.UsageFact;
import com.aiusage.attribution.facts.FactAssembler;
import com.aiusage.attribution.facts.FactMerger;
import com.aiusage.attribution.facts.PartitionLockRegistry;
import com.aiusage.attribution.identity.IdentityMappingView;
import com.aiusage.attribution.identity.IdentityResolver;
import com.aiusage.attribution.ingestion.FetchWindow;
import com.aiusage.attribution.ingestion.FileDropSourceAdapter;
import com.aiusage.attribution.ingestion.SourceAdapter;
import com.aiusage.attribution.ingestion.SourceFetchException;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.aiusage.attribution.normalization.BillingDeltaNormalizer;
import com.aiusage.attribution.normalization.EmailNormalizer;
import com.aiusage.attribution.reconciliation.GroundTruthProvider;
import com.aiusage.attribution.reconciliation.GroundTruthTotal;
import com.aiusage.attribution.reconciliation.ReconciliationChecker;
import com.aiusage.attribution.reconciliation.ReconciliationPeriod;
import com.aiusage.attribution.reconciliation.ReconciliationService;
import com.aiusage.attribution.support.InMemoryFactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Runs the pipeline over canned vendor responses against an in-memory fact store.
 */
class AttributionPipelineTest {

    private static final LocalDate DAY_ONE = LocalDate.of(2026, 10, 1);
    private static final LocalDate DAY_TWO = LocalDate.of(2026, 10, 2);

    private static final String DAILY_USAGE = """
            {"data": [
              {"date": "2026-10-01", "email": "Alice@Example.com", "totalLinesAdded": 120, "chatRequests": 4},
              {"date": "2026-10-01", "email": "bob@example.com", "totalLinesAdded": 30}
            ]}
            """;

    private static final String AUDIT_LOG = """
            [
              {"id": "evt_1", "created_at": "2026-10-01T09:00:00Z", "event": "conversation_created",
               "actor_info": {"metadata": {"email_address": "alice@example.com"}}},
              {"id": "evt_2", "created_at": "2026-10-01T10:00:00Z", "event": "conversation_created",
               "actor_info": {"metadata": {"email_address": "alice@example.com"}}}
            ]
            """;

    private StubSourceAdapter adapter;
    private InMemoryFactStore store;
    private AttributionProperties properties;
    private List<GroundTruthTotal> invoices;
    private ExecutorService executor;

    @TempDir
    Path inbox;

    @BeforeEach
    void setUp() {
        adapter = new StubSourceAdapter();
        store = new InMemoryFactStore();
        properties = new AttributionProperties();
        invoices = new ArrayList<>();
        executor = Executors.newFixedThreadPool(2);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Nested
    @DisplayName("Successful runs")
    class SuccessfulRuns {

        @Test
        @DisplayName("Should attribute every source and exit with success")
        void shouldIngestAllSources() {
            // Given
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            adapter.respond(ClaudeAiAuditLogNormalizer.SOURCE_ID, AUDIT_LOG);

            // When
            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID,
                    ClaudeAiAuditLogNormalizer.SOURCE_ID));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_SUCCESS);
            assertThat(summary.sources()).extracting(SourceOutcome::getStatus)
                    .containsOnly(SourceStatus.SUCCEEDED);
            assertThat(store.usageFacts()).hasSize(3);
            assertThat(store.usageFacts())
                    .filteredOn(fact -> fact.getPlatformCategory() == PlatformCategory.CLAUDE_AI)
                    .singleElement()
                    .satisfies(fact -> {
                        assertThat(fact.getCanonicalUserId()).isEqualTo("alice@example.com");
                        assertThat(fact.getMetrics().get("events")).isEqualByComparingTo("2");
                        assertThat(fact.getRunId()).isEqualTo(summary.runId());
                    });
            assertThat(summary.source(ClaudeAiAuditLogNormalizer.SOURCE_ID).getCollisionsSummed()).isEqualTo(1);
            assertThat(store.archives()).hasSize(4);
        }

        @Test
        @DisplayName("Should leave stored facts unchanged when the same window is run again")
        void shouldBeIdempotentOnRerun() {
            // Given
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            RunSummary first = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));
            List<UsageFact> afterFirst = store.usageFacts();

            // When
            RunSummary second = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));

            // Then
            assertThat(first.source(CursorDailyUsageNormalizer.SOURCE_ID).getFactsInserted()).isEqualTo(2);
            SourceOutcome rerun = second.source(CursorDailyUsageNormalizer.SOURCE_ID);
            assertThat(rerun.getFactsInserted()).isZero();
            assertThat(rerun.getFactsReplaced()).isZero();
            assertThat(rerun.getFactsUnchanged()).isEqualTo(2);
            assertThat(store.usageFacts()).hasSameSizeAs(afterFirst);
            assertThat(store.revisions()).isEmpty();
        }

        @Test
        @DisplayName("Should replace a fact whose vendor value changed and keep the prior value as a revision")
        void shouldReplaceChangedFacts() {
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE.replace("\"totalLinesAdded\": 30", "\"totalLinesAdded\": 45"));

            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));

            SourceOutcome outcome = summary.source(CursorDailyUsageNormalizer.SOURCE_ID);
            assertThat(outcome.getFactsReplaced()).isEqualTo(1);
            assertThat(outcome.getFactsUnchanged()).isEqualTo(1);
            assertThat(store.revisions()).singleElement()
                    .satisfies(revision -> assertThat(revision.getPriorValue()).contains("30"));
        }

        @Test
        @DisplayName("Should turn cycle-to-date spend into daily deltas across runs")
        void shouldDeriveSpendDeltasAcrossRuns() {
            // Given
            adapter.respond(CursorSpendNormalizer.SOURCE_ID, spend("2026-10-01T23:00:00Z", 1000));
            pipeline().run(request(DAY_ONE, CursorSpendNormalizer.SOURCE_ID));
            adapter.respond(CursorSpendNormalizer.SOURCE_ID, spend("2026-10-02T23:00:00Z", 1500));

            // When
            RunSummary summary = pipeline().run(request(DAY_TWO, CursorSpendNormalizer.SOURCE_ID));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_SUCCESS);
            assertThat(store.costFacts())
                    .extracting(CostFact::getFactDate, CostFact::getAmountMinorUnits)
                    .containsExactlyInAnyOrder(
                            tuple(DAY_ONE, new BigDecimal("1000")),
                            tuple(DAY_TWO, new BigDecimal("500")));
            assertThat(store.checkpoints()).hasSize(2);
        }

        @Test
        @DisplayName("Should re-derive the same spend delta when a day is run twice")
        void shouldKeepSpendDeltaStableOnRerun() {
            adapter.respond(CursorSpendNormalizer.SOURCE_ID, spend("2026-10-01T23:00:00Z", 1000));
            pipeline().run(request(DAY_ONE, CursorSpendNormalizer.SOURCE_ID));
            adapter.respond(CursorSpendNormalizer.SOURCE_ID, spend("2026-10-02T23:00:00Z", 1500));
            pipeline().run(request(DAY_TWO, CursorSpendNormalizer.SOURCE_ID));

            RunSummary rerun = pipeline().run(request(DAY_TWO, CursorSpendNormalizer.SOURCE_ID));

            assertThat(rerun.source(CursorSpendNormalizer.SOURCE_ID).getFactsUnchanged()).isEqualTo(1);
            assertThat(store.costFacts()).hasSize(2);
        }

        @Test
        @DisplayName("Should derive one spend delta per dropped file over a multi-day window")
        void shouldDeriveSpendDeltasFromDailyFileDrops() throws IOException {
            // Given
            Path spendDir = Files.createDirectories(inbox.resolve(CursorSpendNormalizer.SOURCE_ID));
            Files.writeString(spendDir.resolve("2026-10-01.json"), undatedSpend(1000));
            Files.writeString(spendDir.resolve("2026-10-02.json"), undatedSpend(1500));
            FetchWindow window = new FetchWindow(DAY_ONE, DAY_TWO);

            // When
            RunSummary summary = pipeline(new FileDropSourceAdapter(inbox.toString())).run(
                    new RunRequest(window, List.of(CursorSpendNormalizer.SOURCE_ID), false, null));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_SUCCESS);
            SourceOutcome outcome = summary.source(CursorSpendNormalizer.SOURCE_ID);
            assertThat(outcome.anomalyCount(AnomalyCategory.CYCLE_BOUNDARY_ANOMALY)).isZero();
            assertThat(outcome.anomalyCount(AnomalyCategory.BASELINE_HELD)).isZero();
            assertThat(store.costFacts())
                    .extracting(CostFact::getFactDate, CostFact::getAmountMinorUnits)
                    .containsExactlyInAnyOrder(
                            tuple(DAY_ONE, new BigDecimal("1000")),
                            tuple(DAY_TWO, new BigDecimal("500")));
        }

        @Test
        @DisplayName("Should reconcile stored cost against invoices after merging")
        void shouldReconcileAfterMerge() {
            adapter.respond(CursorSpendNormalizer.SOURCE_ID, spend("2026-10-01T23:00:00Z", 1000));
            invoices.add(new GroundTruthTotal("INV-1", new ReconciliationPeriod(DAY_ONE, DAY_ONE),
                    new BigDecimal("1200"), "USD", Set.of(CursorSpendNormalizer.SOURCE_ID), null));

            RunSummary summary = pipeline().run(new RunRequest(FetchWindow.ofDay(DAY_ONE),
                    List.of(CursorSpendNormalizer.SOURCE_ID), true, null));

            assertThat(summary.reconciliations()).singleElement()
                    .satisfies(report -> assertThat(report.isFlagged()).isTrue());
            assertThat(summary.anomalyTotals()).containsEntry(AnomalyCategory.RECONCILIATION_VARIANCE, 1);
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_SUCCESS);
            assertThat(store.costFacts()).extracting(CostFact::getReconciliationStatus)
                    .containsOnly(ReconciliationStatus.VARIANCE_FLAGGED);
        }

        @Test
        @DisplayName("Should delete the window's facts before re-ingesting a backfill")
        void shouldBackfillWindow() {
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, """
                    {"data": [{"date": "2026-10-01", "email": "alice@example.com", "totalLinesAdded": 150}]}
                    """);

            RunSummary summary = pipeline().run(new RunRequest(FetchWindow.ofDay(DAY_ONE),
                    List.of(CursorDailyUsageNormalizer.SOURCE_ID), false, "vendor restated usage"));

            SourceOutcome outcome = summary.source(CursorDailyUsageNormalizer.SOURCE_ID);
            assertThat(outcome.getFactsBackfilled()).isEqualTo(2);
            assertThat(outcome.getFactsInserted()).isEqualTo(1);
            assertThat(store.usageFacts()).singleElement()
                    .satisfies(fact -> assertThat(fact.getCanonicalUserId()).isEqualTo("alice@example.com"));
            assertThat(store.revisions()).hasSize(2)
                    .allSatisfy(revision -> assertThat(revision.getNote()).isEqualTo("vendor restated usage"));
        }
    }

    @Nested
    @DisplayName("Failure isolation")
    class FailureIsolation {

        @Test
        @DisplayName("Should fail an unparseable source, keep the others and exit as partial success")
        void shouldIsolateUnparseableSource() {
            // Given
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            adapter.respond(ClaudeAiAuditLogNormalizer.SOURCE_ID, "<html>502 Bad Gateway</html>");

            // When
            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID,
                    ClaudeAiAuditLogNormalizer.SOURCE_ID));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_PARTIAL);
            assertThat(summary.source(CursorDailyUsageNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.SUCCEEDED);
            SourceOutcome failed = summary.source(ClaudeAiAuditLogNormalizer.SOURCE_ID);
            assertThat(failed.getStatus()).isEqualTo(SourceStatus.FAILED);
            assertThat(failed.anomalyCount(AnomalyCategory.SOURCE_UNPARSEABLE)).isGreaterThanOrEqualTo(1);
            assertThat(store.usageFacts()).hasSize(2);
            assertThat(store.archives())
                    .anySatisfy(archive -> assertThat(archive.getPayload()).contains("502 Bad Gateway"));
        }

        @Test
        @DisplayName("Should degrade a source with some unparseable rows")
        void shouldDegradeOnBadRows() {
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, """
                    {"data": [
                      {"date": "2026-10-01", "email": "alice@example.com", "chatRequests": 3},
                      {"email": "bob@example.com", "chatRequests": 1}
                    ]}
                    """);

            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));

            SourceOutcome outcome = summary.source(CursorDailyUsageNormalizer.SOURCE_ID);
            assertThat(outcome.getStatus()).isEqualTo(SourceStatus.DEGRADED);
            assertThat(outcome.anomalyCount(AnomalyCategory.SOURCE_UNPARSEABLE)).isEqualTo(1);
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_PARTIAL);
            assertThat(store.usageFacts()).hasSize(1);
        }

        @Test
        @DisplayName("Should exit with failure when every source fails")
        void shouldFailWhenAllSourcesFail() {
            adapter.failFetch(CursorDailyUsageNormalizer.SOURCE_ID);
            adapter.failFetch(ClaudeAiAuditLogNormalizer.SOURCE_ID);

            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID,
                    ClaudeAiAuditLogNormalizer.SOURCE_ID));

            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FAILURE);
            assertThat(summary.anomalyTotals()).containsEntry(AnomalyCategory.SOURCE_FETCH_FAILED, 2);
            assertThat(store.usageFacts()).isEmpty();
        }

        @Test
        @DisplayName("Should fail a source that has no registered normalizer")
        void shouldFailUnknownSource() {
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);

            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID, "github_copilot"));

            assertThat(summary.source("github_copilot").getStatus()).isEqualTo(SourceStatus.FAILED);
            assertThat(summary.source("github_copilot").getFailureReason()).contains("no normalizer");
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_PARTIAL);
        }

        @Test
        @DisplayName("Should skip a source disabled in configuration")
        void shouldSkipDisabledSource() {
            AttributionProperties.SourceSettings disabled = new AttributionProperties.SourceSettings();
            disabled.setEnabled(false);
            properties.getSources().put(ClaudeAiAuditLogNormalizer.SOURCE_ID, disabled);
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            adapter.respond(ClaudeAiAuditLogNormalizer.SOURCE_ID, AUDIT_LOG);

            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID,
                    ClaudeAiAuditLogNormalizer.SOURCE_ID));

            assertThat(summary.source(ClaudeAiAuditLogNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.SKIPPED);
            assertThat(adapter.fetched).containsExactly(CursorDailyUsageNormalizer.SOURCE_ID);
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_PARTIAL);
        }

        @Test
        @DisplayName("Should abort merging and skip remaining sources when the fact store is unavailable")
        void shouldAbortOnStorageOutage() {
            // Given
            UnavailableFactStore unavailable = new UnavailableFactStore();
            store = unavailable;
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            adapter.respond(ClaudeAiAuditLogNormalizer.SOURCE_ID, AUDIT_LOG);

            // When
            RunSummary summary = pipeline().run(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID,
                    ClaudeAiAuditLogNormalizer.SOURCE_ID));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FAILURE);
            assertThat(summary.fatalError()).contains("unavailable");
            assertThat(summary.source(CursorDailyUsageNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.FAILED);
            assertThat(summary.source(ClaudeAiAuditLogNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.SKIPPED);
            assertThat(unavailable.usageFacts()).isEmpty();
        }

        @Test
        @DisplayName("Should abort the run when stored checkpoints cannot be read while preparing")
        void shouldAbortWhenCheckpointLookupFails() {
            // Given
            store = new CheckpointOutageFactStore();
            adapter.respond(CursorSpendNormalizer.SOURCE_ID, spend("2026-10-01T23:00:00Z", 1000));
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);

            // When
            RunSummary summary = pipeline().run(request(DAY_ONE, CursorSpendNormalizer.SOURCE_ID,
                    CursorDailyUsageNormalizer.SOURCE_ID));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_FAILURE);
            assertThat(summary.fatalError()).contains("unavailable");
            assertThat(summary.source(CursorSpendNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.FAILED);
            assertThat(summary.source(CursorDailyUsageNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.SKIPPED);
            assertThat(store.usageFacts()).isEmpty();
            assertThat(store.costFacts()).isEmpty();
        }

        @Test
        @DisplayName("Should fail only the source whose batch the store rejects and still summarize the run")
        void shouldIsolateRejectedBatch() {
            // Given
            store = new RejectingFactStore(ClaudeAiAuditLogNormalizer.SOURCE_ID);
            adapter.respond(ClaudeAiAuditLogNormalizer.SOURCE_ID, AUDIT_LOG);
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);

            // When
            RunSummary summary = pipeline().run(request(DAY_ONE, ClaudeAiAuditLogNormalizer.SOURCE_ID,
                    CursorDailyUsageNormalizer.SOURCE_ID));

            // Then
            assertThat(summary.exitCode()).isEqualTo(RunSummary.EXIT_PARTIAL);
            assertThat(summary.fatalError()).isNull();
            SourceOutcome rejected = summary.source(ClaudeAiAuditLogNormalizer.SOURCE_ID);
            assertThat(rejected.getStatus()).isEqualTo(SourceStatus.FAILED);
            assertThat(rejected.anomalyCount(AnomalyCategory.MERGE_REJECTED)).isEqualTo(1);
            assertThat(summary.source(CursorDailyUsageNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.SUCCEEDED);
            assertThat(store.usageFacts()).hasSize(2)
                    .allSatisfy(fact -> assertThat(fact.getSourceId()).isEqualTo(CursorDailyUsageNormalizer.SOURCE_ID));
        }

        @Test
        @DisplayName("Should skip every source of a run cancelled before merging")
        void shouldSkipCancelledRun() {
            adapter.respond(CursorDailyUsageNormalizer.SOURCE_ID, DAILY_USAGE);
            PipelineRun run = PipelineRun.start(request(DAY_ONE, CursorDailyUsageNormalizer.SOURCE_ID));
            run.cancel();

            RunSummary summary = pipeline().run(run);

            assertThat(summary.cancelled()).isTrue();
            assertThat(summary.source(CursorDailyUsageNormalizer.SOURCE_ID).getStatus()).isEqualTo(SourceStatus.SKIPPED);
            assertThat(store.usageFacts()).isEmpty();
        }
    }

    private AttributionPipeline pipeline() {
        return pipeline(adapter);
    }

    private AttributionPipeline pipeline(SourceAdapter sourceAdapter) {
        EmailNormalizer emailNormalizer = new EmailNormalizer(Map.of());
        FactMerger merger = new FactMerger(store, new PartitionLockRegistry(Duration.ofSeconds(5)), new ObjectMapper(),
                2, Duration.ZERO);
        GroundTruthProvider groundTruth = window -> List.copyOf(invoices);
        ObjectMapper objectMapper = new ObjectMapper();
        return new AttributionPipeline(
                List.of(sourceAdapter),
                new SourceNormalizerRegistry(List.of(
                        new CursorDailyUsageNormalizer(objectMapper),
                        new CursorSpendNormalizer(objectMapper),
                        new ClaudeAiAuditLogNormalizer(objectMapper))),
                IdentityMappingView::empty,
                new IdentityResolver(emailNormalizer, 0.5),
                new PlatformClassifier(List.of(
                        new ExplicitPlatformRule(),
                        new KeyMappingPlatformRule(),
                        new IdentifierPatternRule(properties),
                        new MetricShapeRule())),
                new BillingDeltaNormalizer(BigDecimal.ZERO),
                new FactAssembler(),
                merger,
                store,
                new ReconciliationService(store, groundTruth, new ReconciliationChecker(new BigDecimal("5.0")), merger),
                properties,
                executor);
    }

    private static RunRequest request(LocalDate day, String... sourceIds) {
        return new RunRequest(FetchWindow.ofDay(day), List.of(sourceIds), false, null);
    }

    private static String spend(String snapshotAt, long cents) {
        return """
                {"subscriptionCycleStart": "2026-10-01T00:00:00Z", "snapshotAt": "%s",
                 "teamMemberSpend": [{"email": "alice@example.com", "spendCents": %d}]}
                """.formatted(snapshotAt, cents);
    }

    private static String undatedSpend(long cents) {
        return """
                {"subscriptionCycleStart": "2026-10-01T00:00:00Z",
                 "teamMemberSpend": [{"email": "alice@example.com", "spendCents": %d}]}
                """.formatted(cents);
    }

    private static class StubSourceAdapter implements SourceAdapter {

        private final Map<String, String> responses = new HashMap<>();
        private final Set<String> failing = new HashSet<>();
        private final List<String> fetched = new ArrayList<>();

        void respond(String sourceId, String body) {
            responses.put(sourceId, body);
        }

        void failFetch(String sourceId) {
            failing.add(sourceId);
        }

        @Override
        public boolean supports(String sourceId) {
            return true;
        }

        @Override
        public synchronized List<SourcePayload> fetch(String sourceId, FetchWindow window) {
            fetched.add(sourceId);
            if (failing.contains(sourceId)) {
                throw new SourceFetchException(sourceId, "vendor returned 503 for " + sourceId);
            }
            String body = responses.get(sourceId);
            return body == null ? List.of() : List.of(new SourcePayload(sourceId, body, window, sourceId + ".json"));
        }
    }

    private static class UnavailableFactStore extends InMemoryFactStore {

        @Override
        public synchronized <T> T inTransaction(Supplier<T> work) {
            throw new DataAccessResourceFailureException("connection refused");
        }
    }

    private static class CheckpointOutageFactStore extends InMemoryFactStore {

        @Override
        public synchronized Optional<CumulativeCheckpoint> findLatestCheckpointBefore(String sourceId, String entityKey,
                                                                                      Instant before) {
            throw new DataAccessResourceFailureException("connection reset");
        }
    }

    private static class RejectingFactStore extends InMemoryFactStore {

        private final String rejectedSourceId;

        RejectingFactStore(String rejectedSourceId) {
            this.rejectedSourceId = rejectedSourceId;
        }

        @Override
        public synchronized UsageFact saveUsage(UsageFact fact) {
            if (rejectedSourceId.equals(fact.getSourceId())) {
                throw new DataIntegrityViolationException("value too long for column canonical_user_id");
            }
            return super.saveUsage(fact);
        }
    }
}
