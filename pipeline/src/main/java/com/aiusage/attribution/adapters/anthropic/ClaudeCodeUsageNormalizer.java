package com.aiusage.attribution.adapters.anthropic;

import com.aiusage.attribution.adapters.AbstractSourceNormalizer;
import com.aiusage.attribution.adapters.JsonFields;
import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes the Claude Code productivity report: one row per actor, day and terminal.
 *
 * Each row yields a productivity record. Model breakdown entries yield separate
 * estimated-cost records; the same spend is billed through the cost report, so
 * those records only become cost facts when the source's cost mode asks for it.
 * Token counts of the breakdown are not extracted for the same reason.
 */
@Component
public class ClaudeCodeUsageNormalizer extends AbstractSourceNormalizer {

    public static final String SOURCE_ID = "claude_code_usage";

    private static final List<String> TOOLS = List.of("edit_tool", "multi_edit_tool", "write_tool", "notebook_edit_tool");

    public ClaudeCodeUsageNormalizer(ObjectMapper objectMapper) {
        super(SOURCE_ID, objectMapper);
    }

    @Override
    protected List<RawRecord> parseResponse(JsonNode root, SourcePayload payload) {
        return parseEach(requireArray(root, "data"), payload, this::parseRow);
    }

    private List<RawRecord> parseRow(JsonNode row) {
        Instant date = JsonFields.instant(row, "date");
        if (date == null) {
            throw new IllegalArgumentException("row has no date");
        }
        Instant bucketStart = JsonFields.startOfUtcDay(date);
        Instant bucketEnd = bucketStart.plus(Duration.ofDays(1));
        Map<IdentityHint, String> hints = actorHints(row.path("actor"));

        Map<String, BigDecimal> metrics = new TreeMap<>();
        JsonNode core = row.path("core_metrics");
        putMetric(metrics, "sessions", JsonFields.decimal(core, "num_sessions"));
        putMetric(metrics, Metrics.LINES_ADDED, JsonFields.decimalAt(core, "/lines_of_code/added"));
        putMetric(metrics, Metrics.LINES_REMOVED, JsonFields.decimalAt(core, "/lines_of_code/removed"));
        putMetric(metrics, Metrics.COMMITS, JsonFields.decimal(core, "commits_by_claude_code"));
        putMetric(metrics, "pull_requests", JsonFields.decimal(core, "pull_requests_by_claude_code"));
        JsonNode tools = row.path("tool_actions");
        for (String tool : TOOLS) {
            putMetric(metrics, tool + "_accepted", JsonFields.decimalAt(tools, "/" + tool + "/accepted"));
            putMetric(metrics, tool + "_rejected", JsonFields.decimalAt(tools, "/" + tool + "/rejected"));
        }

        Map<String, String> dimensions = new HashMap<>();
        dimensions.put(Dimensions.PLATFORM, PlatformCategory.CLAUDE_CODE.getWireName());
        dimensions.put("terminal_type", JsonFields.text(row, "terminal_type"));
        dimensions.put("customer_type", JsonFields.text(row, "customer_type"));

        List<RawRecord> records = new ArrayList<>();
        records.add(recordFor(row)
                .bucketStart(bucketStart)
                .bucketEnd(bucketEnd)
                .identityHints(hints)
                .metricFields(metrics)
                .dimensions(dimensions)
                .build());

        for (JsonNode entry : row.path("model_breakdown")) {
            BigDecimal amount = JsonFields.decimalAt(entry, "/estimated_cost/amount");
            if (amount == null) {
                continue;
            }
            String currency = JsonFields.text(entry.path("estimated_cost"), "currency");
            Map<String, String> costDimensions = new HashMap<>();
            costDimensions.put(Dimensions.PLATFORM, PlatformCategory.CLAUDE_CODE.getWireName());
            costDimensions.put(Dimensions.MODEL, JsonFields.text(entry, "model"));
            costDimensions.put(Dimensions.COST_TYPE, "estimated");
            costDimensions.put(Dimensions.CURRENCY, currency == null ? "USD" : currency.toUpperCase(Locale.ROOT));
            records.add(recordFor(entry)
                    .bucketStart(bucketStart)
                    .bucketEnd(bucketEnd)
                    .identityHints(hints)
                    .metricFields(Map.of(Metrics.COST_MINOR_UNITS, amount))
                    .dimensions(costDimensions)
                    .build());
        }
        return records;
    }

    private Map<IdentityHint, String> actorHints(JsonNode actor) {
        Map<IdentityHint, String> hints = new HashMap<>();
        String type = JsonFields.text(actor, "type");
        if ("api_actor".equals(type)) {
            hints.put(IdentityHint.OPAQUE_KEY_ID, JsonFields.text(actor, "api_key_name"));
        } else {
            hints.put(IdentityHint.EMAIL, JsonFields.text(actor, "email_address"));
        }
        return hints;
    }
}
