package com.aiusage.attribution.adapters.cursor;

import com.aiusage.attribution.adapters.AbstractSourceNormalizer;
import com.aiusage.attribution.adapters.JsonFields;
import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes the Cursor team daily usage report: one row per member and day.
 *
 * Rows carry the member email directly. Counters absent from a row are omitted
 * rather than read as zero.
 */
@Component
public class CursorDailyUsageNormalizer extends AbstractSourceNormalizer {

    public static final String SOURCE_ID = "cursor_daily_usage";

    private static final Map<String, String> METRIC_FIELDS = Map.ofEntries(
            Map.entry("totalLinesAdded", "total_lines_added"),
            Map.entry("totalLinesDeleted", "total_lines_deleted"),
            Map.entry("acceptedLinesAdded", "accepted_lines_added"),
            Map.entry("acceptedLinesDeleted", "accepted_lines_deleted"),
            Map.entry("totalApplies", "total_applies"),
            Map.entry("totalAccepts", "total_accepts"),
            Map.entry("totalRejects", "total_rejects"),
            Map.entry("totalTabsShown", "total_tabs_shown"),
            Map.entry("totalTabsAccepted", "total_tabs_accepted"),
            Map.entry("composerRequests", "composer_requests"),
            Map.entry("chatRequests", "chat_requests"),
            Map.entry("agentRequests", "agent_requests"),
            Map.entry("cmdkUsages", "cmdk_usages"),
            Map.entry("subscriptionIncludedReqs", "subscription_included_requests"),
            Map.entry("usageBasedReqs", "usage_based_requests"),
            Map.entry("apiKeyReqs", "api_key_requests"),
            Map.entry("bugbotUsages", "bugbot_usages")
    );

    public CursorDailyUsageNormalizer(ObjectMapper objectMapper) {
        super(SOURCE_ID, objectMapper);
    }

    @Override
    protected List<RawRecord> parseResponse(JsonNode root, SourcePayload payload) {
        return parseEach(requireArray(root, "data"), payload, this::parseRow);
    }

    private List<RawRecord> parseRow(JsonNode row) {
        Instant day = JsonFields.instant(row, "date");
        if (day == null) {
            day = JsonFields.instant(row, "day");
        }
        if (day == null) {
            throw new IllegalArgumentException("row has no date");
        }
        Instant bucketStart = JsonFields.startOfUtcDay(day);

        Map<String, BigDecimal> metrics = new TreeMap<>();
        METRIC_FIELDS.forEach((field, metric) -> putMetric(metrics, metric, JsonFields.decimal(row, field)));

        Map<String, String> dimensions = new HashMap<>();
        dimensions.put(Dimensions.PLATFORM, PlatformCategory.CURSOR.getWireName());
        dimensions.put("most_used_model", JsonFields.text(row, "mostUsedModel"));
        dimensions.put("client_version", JsonFields.text(row, "clientVersion"));

        Map<IdentityHint, String> hints = new HashMap<>();
        hints.put(IdentityHint.EMAIL, JsonFields.text(row, "email"));

        return List.of(recordFor(row)
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(Duration.ofDays(1)))
                .identityHints(hints)
                .metricFields(metrics)
                .dimensions(dimensions)
                .build());
    }
}
