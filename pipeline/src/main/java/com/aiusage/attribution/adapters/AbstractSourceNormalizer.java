package com.aiusage.attribution.adapters;

import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.ingestion.SourcePayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Base class that makes normalization total.
 *
 * A response that is not JSON, or whose envelope has the wrong shape, becomes a
 * single diagnostic record spanning the fetch window. A row that fails to parse
 * becomes a diagnostic record carrying that row, and its siblings are still parsed.
 */
@Slf4j
public abstract class AbstractSourceNormalizer implements SourceNormalizer {

    protected final ObjectMapper objectMapper;
    private final String sourceId;

    protected AbstractSourceNormalizer(String sourceId, ObjectMapper objectMapper) {
        this.sourceId = sourceId;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getSourceId() {
        return sourceId;
    }

    @Override
    public final List<RawRecord> normalize(SourcePayload payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload.rawResponse());
        } catch (JsonProcessingException e) {
            return List.of(unparseable(payload, payload.rawResponse(), "invalid JSON: " + e.getOriginalMessage()));
        }
        if (JsonFields.isAbsent(root)) {
            return List.of(unparseable(payload, payload.rawResponse(), "empty response"));
        }

        try {
            List<RawRecord> records = parseResponse(root, payload);
            log.debug("Normalized {} record(s) from {} page {}", records.size(), sourceId, payload.reference());
            return records;
        } catch (RuntimeException e) {
            return List.of(unparseable(payload, payload.rawResponse(), e.getMessage()));
        }
    }

    /**
     * Parse a well-formed JSON response. Exceptions thrown here mark the whole page unparseable.
     */
    protected abstract List<RawRecord> parseResponse(JsonNode root, SourcePayload payload);

    /**
     * Parse every element independently; a failing element yields a diagnostic record
     * over the given fallback bucket.
     */
    protected List<RawRecord> parseEach(Iterable<JsonNode> rows, SourcePayload payload,
                                        Instant fallbackStart, Instant fallbackEnd, RowParser parser) {
        List<RawRecord> records = new ArrayList<>();
        for (JsonNode row : rows) {
            try {
                records.addAll(parser.parse(row));
            } catch (RuntimeException e) {
                log.warn("Unparseable {} row on page {}: {}", sourceId, payload.reference(), e.getMessage());
                records.add(RawRecord.unparseable(sourceId, fallbackStart, fallbackEnd, row.toString(), e.getMessage()));
            }
        }
        return records;
    }

    protected List<RawRecord> parseEach(Iterable<JsonNode> rows, SourcePayload payload, RowParser parser) {
        return parseEach(rows, payload,
                payload.fetchWindow().startInstant(), payload.fetchWindow().endInstant(), parser);
    }

    protected JsonNode requireArray(JsonNode node, String field) {
        JsonNode array = node.path(field);
        if (!array.isArray()) {
            throw new IllegalArgumentException("expected array '" + field + "' in response");
        }
        return array;
    }

    protected RawRecord.RawRecordBuilder recordFor(JsonNode fragment) {
        return RawRecord.builder()
                .sourceId(sourceId)
                .rawPayload(fragment.toString());
    }

    protected static void putMetric(Map<String, BigDecimal> metrics, String name, BigDecimal value) {
        if (value != null) {
            metrics.put(name, value);
        }
    }

    private RawRecord unparseable(SourcePayload payload, String fragment, String reason) {
        log.warn("Unparseable {} payload {}: {}", sourceId, payload.reference(), reason);
        return RawRecord.unparseable(sourceId,
                payload.fetchWindow().startInstant(), payload.fetchWindow().endInstant(), fragment, reason);
    }

    @FunctionalInterface
    protected interface RowParser {
        List<RawRecord> parse(JsonNode row);
    }
}
