package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import com.aiusage.attribution.domain.model.ResolutionMethod;
import com.aiusage.attribution.facts.FactBatch;
import com.aiusage.attribution.facts.FactMerger;
import com.aiusage.attribution.facts.PartitionLockRegistry;
import com.aiusage.attribution.support.InMemoryFactStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ReconciliationService.
 *
 * Test strategy:
 * 1. Facts are filtered to the invoice's sources and platform
 * 2. Compared facts are annotated with the outcome, values untouched
 */
@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    private static final ReconciliationPeriod SEPTEMBER =
            new ReconciliationPeriod(LocalDate.of(2026, 9, 1), LocalDate.of(2026, 9, 30));

    @Mock
    private GroundTruthProvider groundTruthProvider;

    private InMemoryFactStore store;
    private FactMerger merger;
    private ReconciliationService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryFactStore();
        merger = new FactMerger(store, new PartitionLockRegistry(Duration.ofSeconds(5)), new ObjectMapper(), 3, Duration.ZERO);
        service = new ReconciliationService(store, groundTruthProvider,
                new ReconciliationChecker(new BigDecimal("5.0")), merger);

        merger.upsert("run-1", new FactBatch(List.of(), List.of(
                fact("anthropic_cost", "alice@example.com", "60000"),
                fact("anthropic_cost", "bob@example.com", "34500"),
                fact("cursor_spend", "alice@example.com", "20000")), List.of()));
    }

    @Test
    @DisplayName("Should flag the covered facts when the variance exceeds tolerance")
    void shouldFlagCoveredFacts() {
        // Given
        when(groundTruthProvider.totalsFor(any())).thenReturn(List.of(new GroundTruthTotal(
                "anthropic-2026-09", SEPTEMBER, new BigDecimal("100000"), "USD", Set.of("anthropic_cost"), null)));

        // When
        List<ReconciliationReport> reports = service.reconcile(SEPTEMBER);

        // Then
        assertThat(reports).singleElement().satisfies(report -> {
            assertThat(report.aggregatedMinorUnits()).isEqualByComparingTo("94500");
            assertThat(report.variancePercent()).isEqualByComparingTo("5.50");
            assertThat(report.bySource()).containsOnlyKeys("anthropic_cost");
        });
        assertThat(store.costFacts())
                .filteredOn(fact -> fact.getSourceId().equals("anthropic_cost"))
                .extracting(CostFact::getReconciliationStatus)
                .containsOnly(ReconciliationStatus.VARIANCE_FLAGGED);
        assertThat(store.costFacts())
                .filteredOn(fact -> fact.getSourceId().equals("cursor_spend"))
                .extracting(CostFact::getReconciliationStatus)
                .containsOnly(ReconciliationStatus.PENDING);
    }

    @Test
    @DisplayName("Should annotate without changing any amount")
    void shouldNotChangeAmounts() {
        when(groundTruthProvider.totalsFor(any())).thenReturn(List.of(new GroundTruthTotal(
                "all-2026-09", SEPTEMBER, new BigDecimal("115000"), "USD", Set.of(), null)));

        List<ReconciliationReport> reports = service.reconcile(SEPTEMBER);

        assertThat(reports).singleElement()
                .satisfies(report -> assertThat(report.status()).isEqualTo(ReconciliationStatus.MATCHED));
        assertThat(store.costFacts())
                .extracting(CostFact::getAmountMinorUnits)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("60000"), new BigDecimal("34500"), new BigDecimal("20000"));
        assertThat(store.revisions()).isEmpty();
    }

    @Test
    @DisplayName("Should return no reports when there are no invoices")
    void shouldHandleNoInvoices() {
        when(groundTruthProvider.totalsFor(any())).thenReturn(List.of());

        assertThat(service.reconcile(SEPTEMBER)).isEmpty();
    }

    private static CostFact fact(String sourceId, String user, String amount) {
        return CostFact.builder()
                .factDate(LocalDate.of(2026, 9, 15))
                .sourceId(sourceId)
                .canonicalUserId(user)
                .platformCategory(PlatformCategory.ANTHROPIC_API)
                .dimensionDiscriminator("-")
                .bucketStart(Instant.parse("2026-09-15T00:00:00Z"))
                .bucketEnd(Instant.parse("2026-09-16T00:00:00Z"))
                .attributionMethod(ResolutionMethod.DIRECT_EMAIL)
                .attributionConfidence(1.0)
                .classificationConfidence(1.0)
                .amountMinorUnits(new BigDecimal(amount))
                .currency("USD")
                .reconciliationStatus(ReconciliationStatus.PENDING)
                .build();
    }
}
