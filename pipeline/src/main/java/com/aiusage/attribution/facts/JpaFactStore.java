package com.aiusage.attribution.facts;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.CumulativeCheckpoint;
import com.aiusage.attribution.domain.model.FactNaturalKey;
import com.aiusage.attribution.domain.model.FactRevision;
import com.aiusage.attribution.domain.model.RawPayloadArchive;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import com.aiusage.attribution.domain.model.UsageFact;
import com.aiusage.attribution.domain.repository.CostFactRepository;
import com.aiusage.attribution.domain.repository.CumulativeCheckpointRepository;
import com.aiusage.attribution.domain.repository.FactRevisionRepository;
import com.aiusage.attribution.domain.repository.RawPayloadArchiveRepository;
import com.aiusage.attribution.domain.repository.UsageFactRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Fact store backed by Spring Data JPA repositories.
 */
@Component
@RequiredArgsConstructor
public class JpaFactStore implements FactStore {

    private final UsageFactRepository usageFactRepository;
    private final CostFactRepository costFactRepository;
    private final CumulativeCheckpointRepository checkpointRepository;
    private final FactRevisionRepository revisionRepository;
    private final RawPayloadArchiveRepository archiveRepository;
    private final TransactionTemplate transactionTemplate;

    @Override
    public Optional<UsageFact> findUsage(FactNaturalKey key) {
        return usageFactRepository.findByFactDateAndSourceIdAndCanonicalUserIdAndPlatformCategoryAndDimensionDiscriminator(
                key.factDate(), key.sourceId(), key.canonicalUserId(), key.platformCategory(), key.dimensionDiscriminator());
    }

    @Override
    public Optional<CostFact> findCost(FactNaturalKey key) {
        return costFactRepository.findByFactDateAndSourceIdAndCanonicalUserIdAndPlatformCategoryAndDimensionDiscriminator(
                key.factDate(), key.sourceId(), key.canonicalUserId(), key.platformCategory(), key.dimensionDiscriminator());
    }

    @Override
    public UsageFact saveUsage(UsageFact fact) {
        return usageFactRepository.saveAndFlush(fact);
    }

    @Override
    public CostFact saveCost(CostFact fact) {
        return costFactRepository.saveAndFlush(fact);
    }

    @Override
    public void deleteUsage(UsageFact fact) {
        usageFactRepository.delete(fact);
    }

    @Override
    public void deleteCost(CostFact fact) {
        costFactRepository.delete(fact);
    }

    @Override
    public List<UsageFact> findUsageFacts(String sourceId, LocalDate from, LocalDate to) {
        return usageFactRepository.findBySourceIdAndFactDateBetweenOrderByFactDateAsc(sourceId, from, to);
    }

    @Override
    public List<CostFact> findCostFacts(String sourceId, LocalDate from, LocalDate to) {
        return costFactRepository.findBySourceIdAndFactDateBetweenOrderByFactDateAsc(sourceId, from, to);
    }

    @Override
    public List<CostFact> findCostFactsInPeriod(LocalDate from, LocalDate to) {
        return costFactRepository.findInPeriod(from, to);
    }

    @Override
    public int updateReconciliationStatus(Collection<Long> costFactIds, ReconciliationStatus status) {
        if (costFactIds.isEmpty()) {
            return 0;
        }
        return costFactRepository.updateReconciliationStatus(costFactIds, status);
    }

    @Override
    public Optional<CumulativeCheckpoint> findLatestCheckpointBefore(String sourceId, String entityKey, Instant before) {
        return checkpointRepository.findFirstBySourceIdAndEntityKeyAndObservedAtBeforeOrderByObservedAtDesc(
                sourceId, entityKey, before);
    }

    @Override
    public Optional<CumulativeCheckpoint> findCheckpoint(String sourceId, String entityKey, Instant observedAt) {
        return checkpointRepository.findBySourceIdAndEntityKeyAndObservedAt(sourceId, entityKey, observedAt);
    }

    @Override
    public CumulativeCheckpoint saveCheckpoint(CumulativeCheckpoint checkpoint) {
        return checkpointRepository.saveAndFlush(checkpoint);
    }

    @Override
    public void saveRevision(FactRevision revision) {
        revisionRepository.save(revision);
    }

    @Override
    public boolean archiveExists(String runId, String sourceId, String payloadSha256) {
        return archiveRepository.existsByRunIdAndSourceIdAndPayloadSha256(runId, sourceId, payloadSha256);
    }

    @Override
    public void saveArchive(RawPayloadArchive archive) {
        archiveRepository.save(archive);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        return transactionTemplate.execute(status -> work.get());
    }
}
