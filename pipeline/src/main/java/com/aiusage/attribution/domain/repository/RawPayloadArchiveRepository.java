package com.aiusage.attribution.domain.repository;

import com.aiusage.attribution.domain.model.RawPayloadArchive;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RawPayloadArchiveRepository extends JpaRepository<RawPayloadArchive, Long> {

    boolean existsByRunIdAndSourceIdAndPayloadSha256(String runId, String sourceId, String payloadSha256);
}
