package com.aiusage.attribution.adapters;

import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.ingestion.SourcePayload;

import java.util.List;

/**
 * Translates one source's raw response into canonical records.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * - Total: never throws for malformed input; unparseable fragments become records
 *   carrying a diagnostic and the raw fragment
 * - Stateless: each payload page is normalized independently
 * - Absent vendor fields are omitted, never defaulted to zero
 */
public interface SourceNormalizer {

    String getSourceId();

    List<RawRecord> normalize(SourcePayload payload);
}
