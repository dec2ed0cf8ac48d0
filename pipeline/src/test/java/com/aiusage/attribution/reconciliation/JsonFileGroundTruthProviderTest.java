package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.domain.model.PlatformCategory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonFileGroundTruthProviderTest {

    private static final ReconciliationPeriod SEPTEMBER =
            new ReconciliationPeriod(LocalDate.of(2026, 9, 1), LocalDate.of(2026, 9, 30));

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should read invoices in minor and major units that overlap the window")
    void shouldReadOverlappingInvoices() throws IOException {
        // Given
        Path file = tempDir.resolve("invoices.json");
        Files.writeString(file, """
                {"invoices": [
                  {"reference": "a", "period_start": "2026-09-01", "period_end": "2026-09-30",
                   "amount": "1000.50", "source_ids": ["anthropic_cost"], "platform": "anthropic_api"},
                  {"reference": "b", "period_start": "2026-09-01", "period_end": "2026-09-30",
                   "amount_minor_units": 20000, "currency": "EUR"},
                  {"reference": "c", "period_start": "2026-08-01", "period_end": "2026-08-31",
                   "amount_minor_units": 1}
                ]}
                """);

        // When
        List<GroundTruthTotal> totals = new JsonFileGroundTruthProvider(new ObjectMapper(), file.toString())
                .totalsFor(SEPTEMBER);

        // Then
        assertThat(totals).extracting(GroundTruthTotal::reference).containsExactly("a", "b");
        assertThat(totals.get(0).amountMinorUnits()).isEqualByComparingTo("100050");
        assertThat(totals.get(0).currency()).isEqualTo("USD");
        assertThat(totals.get(0).sourceIds()).containsExactly("anthropic_cost");
        assertThat(totals.get(0).platform()).isEqualTo(PlatformCategory.ANTHROPIC_API);
        assertThat(totals.get(1).currency()).isEqualTo("EUR");
    }

    @Test
    @DisplayName("Should skip invalid entries and keep the rest")
    void shouldSkipInvalidEntries() throws IOException {
        Path file = tempDir.resolve("invoices.json");
        Files.writeString(file, """
                [
                  {"reference": "no-amount", "period_start": "2026-09-01", "period_end": "2026-09-30"},
                  {"reference": "ok", "period_start": "2026-09-01", "period_end": "2026-09-30", "amount": 10}
                ]
                """);

        List<GroundTruthTotal> totals = new JsonFileGroundTruthProvider(new ObjectMapper(), file.toString())
                .totalsFor(SEPTEMBER);

        assertThat(totals).extracting(GroundTruthTotal::reference).containsExactly("ok");
    }

    @Test
    @DisplayName("Should return nothing when no file is configured or it is missing")
    void shouldReturnNothingWithoutFile() {
        assertThat(new JsonFileGroundTruthProvider(new ObjectMapper(), "").totalsFor(SEPTEMBER)).isEmpty();
        assertThat(new JsonFileGroundTruthProvider(new ObjectMapper(), tempDir.resolve("nope.json").toString())
                .totalsFor(SEPTEMBER)).isEmpty();
    }
}
