package com.aiusage.attribution.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Columns shared by usage and cost facts: the natural key, the bucket and the attribution audit.
 *
 * Facts are append-or-replace by natural key. Value comparison ignores runId and updatedAt
 * so that a rerun over unchanged input leaves stored rows untouched.
 */
@MappedSuperclass
@Getter
@Setter
@NoArgsConstructor
@SuperBuilder(toBuilder = true)
public abstract class AttributedFact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "fact_date", nullable = false)
    private LocalDate factDate;

    @Column(name = "source_id", nullable = false, length = 64)
    private String sourceId;

    @Column(name = "canonical_user_id", nullable = false, length = 320)
    private String canonicalUserId;

    @Enumerated(EnumType.STRING)
    @Column(name = "platform_category", nullable = false, length = 32)
    private PlatformCategory platformCategory;

    @Column(name = "dimension_discriminator", nullable = false, length = 512)
    private String dimensionDiscriminator;

    @Column(nullable = false)
    private Instant bucketStart;

    @Column(nullable = false)
    private Instant bucketEnd;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResolutionMethod attributionMethod;

    private double attributionConfidence;

    private double classificationConfidence;

    /**
     * Run that last wrote the row.
     */
    @Column(length = 64)
    private String runId;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }

    public FactNaturalKey naturalKey() {
        return new FactNaturalKey(factDate, sourceId, canonicalUserId, platformCategory, dimensionDiscriminator);
    }

    protected boolean sameAttributionAs(AttributedFact other) {
        return Objects.equals(naturalKey(), other.naturalKey())
                && Objects.equals(bucketStart, other.bucketStart)
                && Objects.equals(bucketEnd, other.bucketEnd)
                && attributionMethod == other.attributionMethod
                && Double.compare(attributionConfidence, other.attributionConfidence) == 0
                && Double.compare(classificationConfidence, other.classificationConfidence) == 0;
    }

    protected void copyAttributionFrom(AttributedFact source) {
        bucketStart = source.bucketStart;
        bucketEnd = source.bucketEnd;
        attributionMethod = source.attributionMethod;
        attributionConfidence = source.attributionConfidence;
        classificationConfidence = source.classificationConfidence;
        runId = source.runId;
    }

    /**
     * Plain snapshot of the row, for revision audit and logging.
     */
    public Map<String, Object> describe() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("naturalKey", naturalKey().toString());
        snapshot.put("bucketStart", String.valueOf(bucketStart));
        snapshot.put("bucketEnd", String.valueOf(bucketEnd));
        snapshot.put("attributionMethod", attributionMethod == null ? null : attributionMethod.getWireName());
        snapshot.put("attributionConfidence", attributionConfidence);
        snapshot.put("classificationConfidence", classificationConfidence);
        snapshot.put("runId", runId);
        return snapshot;
    }

    public abstract FactType factType();
}
