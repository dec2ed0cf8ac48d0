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
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes the Anthropic Admin cost report.
 *
 * AMOUNTS:
 * {@code amount} is a decimal string already expressed in cents.
 *
 * SCOPE:
 * A null workspace_id on a grouped result means the default workspace. Only a
 * result with every grouping field null is an organization-wide total.
 */
@Component
public class AnthropicCostReportNormalizer extends AbstractSourceNormalizer {

    public static final String SOURCE_ID = "anthropic_cost";

    public AnthropicCostReportNormalizer(ObjectMapper objectMapper) {
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
        BigDecimal amount = JsonFields.decimal(result, "amount");
        if (amount == null) {
            throw new IllegalArgumentException("cost result without amount");
        }
        String currency = JsonFields.text(result, "currency");
        String workspaceId = JsonFields.text(result, "workspace_id");
        String description = JsonFields.text(result, "description");
        String model = JsonFields.text(result, "model");
        String costType = JsonFields.text(result, "cost_type");
        String tokenType = JsonFields.text(result, "token_type");

        Map<String, String> dimensions = new HashMap<>();
        dimensions.put(Dimensions.MODEL, model);
        dimensions.put(Dimensions.COST_TYPE, costType);
        dimensions.put(Dimensions.TOKEN_TYPE, tokenType);
        dimensions.put(Dimensions.SERVICE_TIER, JsonFields.text(result, "service_tier"));
        dimensions.put(Dimensions.CONTEXT_WINDOW, JsonFields.text(result, "context_window"));
        dimensions.put(Dimensions.DESCRIPTION, description);
        dimensions.put(Dimensions.CURRENCY, currency == null ? "USD" : currency.toUpperCase(Locale.ROOT));
        boolean ungrouped = workspaceId == null && description == null && model == null
                && costType == null && tokenType == null;
        dimensions.put(Dimensions.SCOPE, ungrouped ? Dimensions.SCOPE_ORGANIZATION : Dimensions.SCOPE_WORKSPACE);

        Map<IdentityHint, String> hints = new HashMap<>();
        hints.put(IdentityHint.WORKSPACE_ID, workspaceId);

        return recordFor(result)
                .bucketStart(range.start())
                .bucketEnd(range.end())
                .identityHints(hints)
                .metricFields(Map.of(Metrics.COST_MINOR_UNITS, amount))
                .dimensions(dimensions)
                .build();
    }
}
