package com.aiusage.attribution.adapters;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Null-tolerant accessors over vendor JSON.
 *
 * Missing and JSON-null fields read as null. Present fields of the wrong type
 * raise IllegalArgumentException, which normalizers turn into diagnostics.
 */
public final class JsonFields {

    private static final Pattern OFFSET_SUFFIX = Pattern.compile("(Z|[+-]\\d{2}:?\\d{2})$");

    private JsonFields() {
    }

    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (isAbsent(value)) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    public static BigDecimal decimal(JsonNode node, String field) {
        return decimalValue(node.path(field), field);
    }

    public static BigDecimal decimalAt(JsonNode node, String pointer) {
        return decimalValue(node.at(pointer), pointer);
    }

    private static BigDecimal decimalValue(JsonNode value, String name) {
        if (isAbsent(value)) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("non-numeric value for " + name + ": " + value.asText());
            }
        }
        throw new IllegalArgumentException("non-numeric value for " + name + ": " + value);
    }

    /**
     * Reads epoch milliseconds, an ISO-8601 date-time (UTC when no offset), or an ISO date (midnight UTC).
     */
    public static Instant instant(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (isAbsent(value)) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return Instant.ofEpochMilli(value.longValue());
        }
        String text = value.asText().trim();
        if (text.chars().allMatch(Character::isDigit) && !text.isEmpty()) {
            return Instant.ofEpochMilli(Long.parseLong(text));
        }
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (OFFSET_SUFFIX.matcher(text).find()) {
                return OffsetDateTime.parse(text).toInstant();
            }
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("unrecognized timestamp for " + field + ": " + text);
        }
    }

    public static Instant startOfUtcDay(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
