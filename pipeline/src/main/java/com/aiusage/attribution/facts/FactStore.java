package com.aiusage.attribution.facts;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import com.aiusage.attribution.domain.model.FactNaturalKey;
import com.aiusage.attribution.domain.model.FactRevision;
import com.aiusage.attribution.domain.model.RawPayloadArchive;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import com.aiusage.attribution.domain.model.UsageFact;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Storage port for facts and their audit trail.
 *
 * Only the FactMerger writes through this port. Reads are open to the pipeline
 * (checkpoint lookup) and reconciliation (cost facts of a period).
 */
public interface FactStore {

    Optional<UsageFact> findUsage(FactNaturalKey key);

    Optional<CostFact> findCost(FactNaturalKey key);

    UsageFact saveUsage(UsageFact fact);

    CostFact saveCost(CostFact fact);

    void deleteUsage(UsageFact fact);

    void deleteCost(CostFact fact);

    List<UsageFact> findUsageFacts(String sourceId, LocalDate from, LocalDate to);

    List<CostFact> findCostFacts(String sourceId, LocalDate from, LocalDate to);

    List<CostFact> findCostFactsInPeriod(LocalDate from, LocalDate to);

    int updateReconciliationStatus(Collection<Long> costFactIds, ReconciliationStatus status);

    Optional<CumulativeCheckpoint> findLatestCheckpointBefore(String sourceId, String entityKey, Instant before);

    Optional<CumulativeCheckpoint> findCheckpoint(String sourceId, String entityKey, Instant observedAt);

    CumulativeCheckpoint saveCheckpoint(CumulativeCheckpoint checkpoint);

    void saveRevision(FactRevision revision);

    boolean archiveExists(String runId, String sourceId, String payloadSha256);

    void saveArchive(RawPayloadArchive archive);

    /**
     * Run the work in one storage transaction; any exception rolls it back.
     */
    <T> T inTransaction(Supplier<T> work);
}
