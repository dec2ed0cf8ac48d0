package com.aiusage.attribution.reconciliation;

import com.aiusage.attribution.adapters.JsonFields;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads manually entered invoice totals from a JSON file.
 *
 * Each invoice has a reference, period_start, period_end, currency, optional
 * source_ids and platform, and either amount_minor_units or amount in major units.
 * Reconciliation is advisory, so an unreadable file yields no totals.
 */
@Component
@Slf4j
public class JsonFileGroundTruthProvider implements GroundTruthProvider {

    private static final BigDecimal MINOR_UNITS_PER_MAJOR = BigDecimal.valueOf(100);

    private final ObjectMapper objectMapper;
    private final String invoicesFile;

    public JsonFileGroundTruthProvider(
            ObjectMapper objectMapper,
            @Value("${attribution.reconciliation.invoices-file:}") String invoicesFile) {
        this.objectMapper = objectMapper;
        this.invoicesFile = invoicesFile;
    }

    @Override
    public List<GroundTruthTotal> totalsFor(ReconciliationPeriod window) {
        if (invoicesFile == null || invoicesFile.isBlank()) {
            log.info("No invoices file configured; skipping reconciliation");
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(Path.of(invoicesFile)));
        } catch (IOException e) {
            log.warn("Failed to read invoices from {}: {}", invoicesFile, e.getMessage());
            return List.of();
        }

        JsonNode invoices = root.isArray() ? root : root.path("invoices");
        List<GroundTruthTotal> totals = new ArrayList<>();
        for (JsonNode invoice : invoices) {
            try {
                GroundTruthTotal total = parse(invoice);
                if (total.period().overlaps(window)) {
                    totals.add(total);
                }
            } catch (RuntimeException e) {
                log.warn("Skipping invalid invoice entry {}: {}", invoice, e.getMessage());
            }
        }
        return totals;
    }

    private GroundTruthTotal parse(JsonNode invoice) {
        String reference = JsonFields.text(invoice, "reference");
        String start = JsonFields.text(invoice, "period_start");
        String end = JsonFields.text(invoice, "period_end");
        if (reference == null || start == null || end == null) {
            throw new IllegalArgumentException("invoice needs reference, period_start and period_end");
        }

        BigDecimal amount = JsonFields.decimal(invoice, "amount_minor_units");
        if (amount == null) {
            BigDecimal major = JsonFields.decimal(invoice, "amount");
            if (major == null) {
                throw new IllegalArgumentException("invoice has no amount");
            }
            amount = major.multiply(MINOR_UNITS_PER_MAJOR);
        }

        Set<String> sourceIds = new HashSet<>();
        invoice.path("source_ids").forEach(node -> sourceIds.add(node.asText()));
        String currency = JsonFields.text(invoice, "currency");
        PlatformCategory platform = PlatformCategory.fromWireName(JsonFields.text(invoice, "platform")).orElse(null);

        return new GroundTruthTotal(
                reference,
                new ReconciliationPeriod(LocalDate.parse(start), LocalDate.parse(end)),
                amount,
                currency == null ? null : currency.toUpperCase(Locale.ROOT),
                sourceIds,
                platform);
    }
}
