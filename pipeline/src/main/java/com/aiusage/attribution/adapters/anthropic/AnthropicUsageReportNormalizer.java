package com.aiusage.attribution.adapters.anthropic;

import com.aiusage.attribution.adapters.AbstractSourceNormalizer;
import com.aiusage.attribution.adapters.JsonFields;
import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes the Anthropic Admin messages usage report.
 *
 * Results grouped by key, workspace or model carry those ids as identity hints.
 * A result with every grouping field null is an organization-wide total and is
 * marked with organization scope so it can be dropped next to its breakdown.
 */
@Component
public class AnthropicUsageReportNormalizer extends AbstractSourceNormalizer {

    public static final String SOURCE_ID = "anthropic_usage";

    public AnthropicUsageReportNormalizer(ObjectMapper objectMapper) {
        super(SOURCE_ID, objectMapper);
    }

    @Override
    protected List<RawRecord> parseResponse(JsonNode root, SourcePayload payload) {
        return parseEach(requireArray(root, "data"), payload, bucket -> parseBucket(bucket, payload));
    }

    private List<RawRecord> parseBucket(JsonNode bucket, SourcePayload payload) {
        AnthropicReportBuckets range = AnthropicReportBuckets.of(bucket);
        return parseEach(requireArray(bucket, "results"), payload, range.start(), range.end(),
                result -> List.of(parseResult(result, range)));
    }

    private RawRecord parseResult(JsonNode result, AnthropicReportBuckets range) {
        String keyId = JsonFields.text(result, "api_key_id");
        String workspaceId = JsonFields.text(result, "workspace_id");
        String model = JsonFields.text(result, "model");

        Map<String, BigDecimal> metrics = new TreeMap<>();
        putMetric(metrics, Metrics.INPUT_TOKENS, JsonFields.decimal(result, "uncached_input_tokens"));
        putMetric(metrics, Metrics.OUTPUT_TOKENS, JsonFields.decimal(result, "output_tokens"));
        putMetric(metrics, Metrics.CACHE_READ_INPUT_TOKENS, JsonFields.decimal(result, "cache_read_input_tokens"));
        BigDecimal oneHour = JsonFields.decimalAt(result, "/cache_creation/ephemeral_1h_input_tokens");
        BigDecimal fiveMinutes = JsonFields.decimalAt(result, "/cache_creation/ephemeral_5m_input_tokens");
        if (oneHour != null || fiveMinutes != null) {
            metrics.put(Metrics.CACHE_CREATION_INPUT_TOKENS,
                    (oneHour == null ? BigDecimal.ZERO : oneHour).add(fiveMinutes == null ? BigDecimal.ZERO : fiveMinutes));
        }
        putMetric(metrics, Metrics.WEB_SEARCH_REQUESTS, JsonFields.decimalAt(result, "/server_tool_use/web_search_requests"));

        Map<IdentityHint, String> hints = new HashMap<>();
        hints.put(IdentityHint.OPAQUE_KEY_ID, keyId);
        hints.put(IdentityHint.WORKSPACE_ID, workspaceId);

        Map<String, String> dimensions = new HashMap<>();
        dimensions.put(Dimensions.MODEL, model);
        dimensions.put(Dimensions.SERVICE_TIER, JsonFields.text(result, "service_tier"));
        dimensions.put(Dimensions.CONTEXT_WINDOW, JsonFields.text(result, "context_window"));
        boolean ungrouped = keyId == null && workspaceId == null && model == null;
        dimensions.put(Dimensions.SCOPE, ungrouped ? Dimensions.SCOPE_ORGANIZATION : Dimensions.SCOPE_WORKSPACE);

        return recordFor(result)
                .bucketStart(range.start())
                .bucketEnd(range.end())
                .identityHints(hints)
                .metricFields(metrics)
                .dimensions(dimensions)
                .build();
    }
}
