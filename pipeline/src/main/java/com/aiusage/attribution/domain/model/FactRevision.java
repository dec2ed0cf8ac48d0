package com.aiusage.attribution.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Audit row written whenever a stored fact is replaced or removed by a backfill.
 */
@Entity
@Table(name = "fact_revisions", indexes = {
    @Index(name = "idx_fact_revision_key", columnList = "naturalKey"),
    @Index(name = "idx_fact_revision_run", columnList = "runId")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FactRevision {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 8)
    private FactType factType;

    @Column(nullable = false, length = 1024)
    private String naturalKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private RevisionReason reason;

    @Column(nullable = false, length = 8000)
    private String priorValue;

    /**
     * Null when the fact was deleted.
     */
    @Column(length = 8000)
    private String newValue;

    @Column(length = 512)
    private String note;

    @Column(length = 64)
    private String runId;

    @Column(nullable = false)
    private Instant revisedAt;

    @PrePersist
    protected void onCreate() {
        if (revisedAt == null) {
            revisedAt = Instant.now();
        }
    }

    public enum RevisionReason {
        REPLACED,
        BACKFILL
    }
}
