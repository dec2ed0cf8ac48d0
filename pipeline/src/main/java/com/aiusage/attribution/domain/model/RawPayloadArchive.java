package com.aiusage.attribution.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Untransformed vendor payload kept for audit. Rows are written once and never updated.
 */
@Entity
@Table(name = "raw_payload_archive",
        uniqueConstraints = @UniqueConstraint(name = "uk_raw_payload_digest",
                columnNames = {"run_id", "source_id", "payload_sha256"}),
        indexes = @Index(name = "idx_raw_payload_source", columnList = "source_id, bucket_start"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RawPayloadArchive {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, length = 64, updatable = false)
    private String runId;

    @Column(name = "source_id", nullable = false, length = 64, updatable = false)
    private String sourceId;

    @Column(name = "bucket_start", nullable = false, updatable = false)
    private Instant bucketStart;

    @Column(nullable = false, updatable = false)
    private Instant bucketEnd;

    @Column(name = "payload_sha256", nullable = false, length = 64, updatable = false)
    private String payloadSha256;

    @Column(length = 1_000_000, updatable = false)
    private String payload;

    @Column(length = 1024, updatable = false)
    private String diagnostic;

    @Column(nullable = false, updatable = false)
    private Instant archivedAt;

    @PrePersist
    protected void onCreate() {
        archivedAt = Instant.now();
    }
}
