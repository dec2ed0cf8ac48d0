package com.aiusage.attribution.domain.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Canonical envelope every source normalizer emits, before attribution.
 *
 * The bucket is the half-open UTC range [bucketStart, bucketEnd). For cumulative
 * snapshots bucketEnd is the observation time and billingCycleStart is mandatory.
 * A record carrying a diagnostic could not be parsed; its metrics are empty and
 * rawPayload holds the offending fragment.
 */
@Builder(toBuilder = true)
public record RawRecord(
        String sourceId,
        Instant bucketStart,
        Instant bucketEnd,
        Map<IdentityHint, String> identityHints,
        Map<String, BigDecimal> metricFields,
        Map<String, String> dimensions,
        boolean cumulative,
        Instant billingCycleStart,
        String rawPayload,
        String diagnostic
) {

    public RawRecord {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        Objects.requireNonNull(bucketStart, "bucketStart");
        Objects.requireNonNull(bucketEnd, "bucketEnd");
        if (!bucketStart.isBefore(bucketEnd)) {
            throw new IllegalArgumentException("bucketStart must precede bucketEnd: " + bucketStart + " / " + bucketEnd);
        }
        if (cumulative && billingCycleStart == null) {
            throw new IllegalArgumentException("cumulative record requires billingCycleStart");
        }
        identityHints = copyHints(identityHints);
        metricFields = copyMetrics(metricFields);
        dimensions = copyDimensions(dimensions);
    }

    public static RawRecord unparseable(String sourceId, Instant bucketStart, Instant bucketEnd,
                                        String rawPayload, String diagnostic) {
        return RawRecord.builder()
                .sourceId(sourceId)
                .bucketStart(bucketStart)
                .bucketEnd(bucketEnd)
                .rawPayload(rawPayload)
                .diagnostic(diagnostic == null ? "unparseable payload" : diagnostic)
                .build();
    }

    public boolean isUnparseable() {
        return diagnostic != null;
    }

    public Optional<String> hint(IdentityHint hint) {
        return Optional.ofNullable(identityHints.get(hint));
    }

    public Optional<String> dimension(String name) {
        return Optional.ofNullable(dimensions.get(name));
    }

    public Instant observedAt() {
        return bucketEnd;
    }

    /**
     * An aggregate over the whole organization with no per-entity breakdown.
     */
    public boolean isOrganizationAggregate() {
        return identityHints.isEmpty()
                && Dimensions.SCOPE_ORGANIZATION.equals(dimensions.get(Dimensions.SCOPE));
    }

    /**
     * Identity of the record's content, independent of its raw payload and of metric scale.
     */
    public ContentKey contentKey() {
        Map<String, BigDecimal> normalized = new TreeMap<>();
        metricFields.forEach((name, value) -> normalized.put(name, value.stripTrailingZeros()));
        return new ContentKey(sourceId, bucketStart, bucketEnd, identityHints, normalized, dimensions);
    }

    public record ContentKey(
            String sourceId,
            Instant bucketStart,
            Instant bucketEnd,
            Map<IdentityHint, String> identityHints,
            Map<String, BigDecimal> metricFields,
            Map<String, String> dimensions
    ) {
    }

    private static Map<IdentityHint, String> copyHints(Map<IdentityHint, String> hints) {
        Map<IdentityHint, String> copy = new EnumMap<>(IdentityHint.class);
        if (hints != null) {
            hints.forEach((hint, value) -> {
                if (hint != null && value != null && !value.isBlank()) {
                    copy.put(hint, value.trim());
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, BigDecimal> copyMetrics(Map<String, BigDecimal> metrics) {
        Map<String, BigDecimal> copy = new TreeMap<>();
        if (metrics != null) {
            metrics.forEach((name, value) -> {
                if (name == null || value == null) {
                    throw new IllegalArgumentException("metric names and values must not be null");
                }
                copy.put(name, value);
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Map<String, String> copyDimensions(Map<String, String> dimensions) {
        Map<String, String> copy = new TreeMap<>();
        if (dimensions != null) {
            dimensions.forEach((name, value) -> {
                if (name != null && value != null && !value.isBlank()) {
                    copy.put(name, value.trim());
                }
            });
        }
        return Collections.unmodifiableMap(copy);
    }
}
