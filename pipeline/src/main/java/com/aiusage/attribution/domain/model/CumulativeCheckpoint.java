package com.aiusage.attribution.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Last cumulative value observed for a billing entity at a point in time.
 *
 * The next run seeds its delta computation from the latest checkpoint strictly
 * before its first snapshot, so rerunning a day reproduces the same deltas.
 */
@Entity
@Table(name = "cumulative_checkpoints",
        uniqueConstraints = @UniqueConstraint(name = "uk_checkpoint_observation",
                columnNames = {"source_id", "entity_key", "observed_at"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CumulativeCheckpoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false, length = 64)
    private String sourceId;

    @Column(name = "entity_key", nullable = false, length = 1024)
    private String entityKey;

    @Column(nullable = false)
    private Instant billingCycleStart;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Convert(converter = MetricMapConverter.class)
    @Column(nullable = false, length = 4000)
    private Map<String, BigDecimal> metricValues;

    @Column(length = 64)
    private String runId;

    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
