package com.aiusage.attribution.domain.repository;

import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.UsageFact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface UsageFactRepository extends JpaRepository<UsageFact, Long> {

    /**
     * Look up a fact by its natural key.
     */
    Optional<UsageFact> findByFactDateAndSourceIdAndCanonicalUserIdAndPlatformCategoryAndDimensionDiscriminator(
            LocalDate factDate,
            String sourceId,
            String canonicalUserId,
            PlatformCategory platformCategory,
            String dimensionDiscriminator
    );

    List<UsageFact> findBySourceIdAndFactDateBetweenOrderByFactDateAsc(
            String sourceId,
            LocalDate startDate,
            LocalDate endDate
    );
}
