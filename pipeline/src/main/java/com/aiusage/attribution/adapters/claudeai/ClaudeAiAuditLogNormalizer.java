package com.aiusage.attribution.adapters.claudeai;

import com.aiusage.attribution.adapters.AbstractSourceNormalizer;
import com.aiusage.attribution.adapters.JsonFields;
import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes claude.ai Enterprise audit log exports, one record per event.
 *
 * Exports come either as a bare array or wrapped in {@code events} / {@code data}.
 * {@code actor_info} is sometimes an embedded JSON string, and the email may sit
 * under its {@code metadata}.
 */
@Component
public class ClaudeAiAuditLogNormalizer extends AbstractSourceNormalizer {

    public static final String SOURCE_ID = "claude_ai_audit";

    public ClaudeAiAuditLogNormalizer(ObjectMapper objectMapper) {
        super(SOURCE_ID, objectMapper);
    }

    @Override
    protected List<RawRecord> parseResponse(JsonNode root, SourcePayload payload) {
        JsonNode events;
        if (root.isArray()) {
            events = root;
        } else if (root.path("events").isArray()) {
            events = root.path("events");
        } else {
            events = requireArray(root, "data");
        }
        return parseEach(events, payload, event -> List.of(parseEvent(event)));
    }

    private RawRecord parseEvent(JsonNode event) {
        Instant createdAt = JsonFields.instant(event, "created_at");
        if (createdAt == null) {
            createdAt = JsonFields.instant(event, "timestamp");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("event has no created_at");
        }
        String eventType = firstText(event, "event", "event_type", "action");
        if (eventType == null) {
            throw new IllegalArgumentException("event has no type");
        }
        Instant bucketStart = JsonFields.startOfUtcDay(createdAt);

        Map<String, String> dimensions = new HashMap<>();
        dimensions.put(Dimensions.PLATFORM, PlatformCategory.CLAUDE_AI.getWireName());
        dimensions.put(Dimensions.EVENT_TYPE, eventType);
        dimensions.put("client_platform", JsonFields.text(event, "client_platform"));
        String eventId = firstText(event, "id", "uuid");
        dimensions.put("event_id", eventId == null ? createdAt.toString() : eventId);

        Map<IdentityHint, String> hints = new HashMap<>();
        hints.put(IdentityHint.EMAIL, actorEmail(event));

        return recordFor(event)
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(Duration.ofDays(1)))
                .identityHints(hints)
                .metricFields(Map.of(Metrics.EVENTS, BigDecimal.ONE))
                .dimensions(dimensions)
                .build();
    }

    private String actorEmail(JsonNode event) {
        JsonNode actorInfo = event.path("actor_info");
        if (actorInfo.isTextual()) {
            try {
                actorInfo = objectMapper.readTree(actorInfo.asText());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("actor_info is not valid JSON", e);
            }
        }
        String email = JsonFields.text(actorInfo.path("metadata"), "email_address");
        if (email == null) {
            email = JsonFields.text(actorInfo, "email_address");
        }
        if (email == null) {
            email = firstText(event, "actor_email", "user_email");
        }
        return email;
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = JsonFields.text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
