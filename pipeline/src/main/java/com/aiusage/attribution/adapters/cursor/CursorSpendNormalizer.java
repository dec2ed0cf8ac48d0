package com.aiusage.attribution.adapters.cursor;

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
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes the Cursor team spend report into cumulative snapshots.
 *
 * CUMULATIVE SEMANTICS:
 * Spend is reported month-to-date per member since the subscription cycle start.
 * The snapshot is taken as of the end of the fetch window unless the response
 * carries its own snapshotAt. Billed amount is paid spend plus included spend,
 * both in cents.
 */
@Component
public class CursorSpendNormalizer extends AbstractSourceNormalizer {

    public static final String SOURCE_ID = "cursor_spend";

    public CursorSpendNormalizer(ObjectMapper objectMapper) {
        super(SOURCE_ID, objectMapper);
    }

    @Override
    protected List<RawRecord> parseResponse(JsonNode root, SourcePayload payload) {
        JsonNode members = requireArray(root, "teamMemberSpend");
        Instant observedAt = JsonFields.instant(root, "snapshotAt");
        if (observedAt == null) {
            observedAt = payload.fetchWindow().endInstant();
        }
        Instant cycleStart = JsonFields.instant(root, "subscriptionCycleStart");
        Instant bucketStart = JsonFields.startOfUtcDay(observedAt.minusNanos(1));
        Instant observation = observedAt;

        return parseEach(members, payload, row -> parseMember(row, bucketStart, observation, cycleStart));
    }

    private List<RawRecord> parseMember(JsonNode row, Instant bucketStart, Instant observedAt, Instant cycleStart) {
        if (cycleStart == null) {
            throw new IllegalArgumentException("response has no subscriptionCycleStart");
        }
        BigDecimal spend = JsonFields.decimal(row, "spendCents");
        BigDecimal included = JsonFields.decimal(row, "includedSpendCents");
        if (spend == null && included == null) {
            throw new IllegalArgumentException("member row has no spend fields");
        }

        Map<String, BigDecimal> metrics = new TreeMap<>();
        metrics.put(Metrics.COST_MINOR_UNITS,
                (spend == null ? BigDecimal.ZERO : spend).add(included == null ? BigDecimal.ZERO : included));
        putMetric(metrics, "premium_requests", JsonFields.decimal(row, "fastPremiumRequests"));

        return List.of(recordFor(row)
                .bucketStart(bucketStart)
                .bucketEnd(observedAt)
                .identityHints(Map.of(IdentityHint.EMAIL, nullToBlank(JsonFields.text(row, "email"))))
                .metricFields(metrics)
                .dimensions(Map.of(
                        Dimensions.PLATFORM, PlatformCategory.CURSOR.getWireName(),
                        Dimensions.COST_TYPE, "team_member_spend",
                        Dimensions.CURRENCY, "USD"))
                .cumulative(true)
                .billingCycleStart(cycleStart)
                .build());
    }

    private static String nullToBlank(String value) {
        return value == null ? "" : value;
    }
}
