package com.aiusage.attribution.domain.repository;

import com.aiusage.attribution.domain.model.CostFact;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.ReconciliationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CostFactRepository extends JpaRepository<CostFact, Long> {

    /**
     * Look up a fact by its natural key.
     */
    Optional<CostFact> findByFactDateAndSourceIdAndCanonicalUserIdAndPlatformCategoryAndDimensionDiscriminator(
            LocalDate factDate,
            String sourceId,
            String canonicalUserId,
            PlatformCategory platformCategory,
            String dimensionDiscriminator
    );

    List<CostFact> findBySourceIdAndFactDateBetweenOrderByFactDateAsc(
            String sourceId,
            LocalDate startDate,
            LocalDate endDate
    );

    /**
     * All cost facts of a reconciliation period, in a stable order.
     */
    @Query("SELECT c FROM CostFact c WHERE c.factDate BETWEEN :startDate AND :endDate " +
           "ORDER BY c.factDate, c.sourceId, c.canonicalUserId")
    List<CostFact> findInPeriod(
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate
    );

    /**
     * Touch only the advisory status column of the given rows.
     */
    @Modifying
    @Query("UPDATE CostFact c SET c.reconciliationStatus = :status WHERE c.id IN :ids")
    int updateReconciliationStatus(
            @Param("ids") Collection<Long> ids,
            @Param("status") ReconciliationStatus status
    );
}
