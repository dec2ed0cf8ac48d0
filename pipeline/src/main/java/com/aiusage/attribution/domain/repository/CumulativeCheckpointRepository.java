package com.aiusage.attribution.domain.repository;

import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface CumulativeCheckpointRepository extends JpaRepository<CumulativeCheckpoint, Long> {

    /**
     * Latest checkpoint observed strictly before the given instant.
     */
    Optional<CumulativeCheckpoint> findFirstBySourceIdAndEntityKeyAndObservedAtBeforeOrderByObservedAtDesc(
            String sourceId,
            String entityKey,
            Instant before
    );

    Optional<CumulativeCheckpoint> findBySourceIdAndEntityKeyAndObservedAt(
            String sourceId,
            String entityKey,
            Instant observedAt
    );
}
