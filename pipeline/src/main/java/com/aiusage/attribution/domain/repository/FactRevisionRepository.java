package com.aiusage.attribution.domain.repository;

import com.aiusage.attribution.domain.model.FactRevision;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FactRevisionRepository extends JpaRepository<FactRevision, Long> {

    List<FactRevision> findByNaturalKeyOrderByRevisedAtAsc(String naturalKey);
}
