package com.aiusage.attribution.ingestion;

import java.util.List;

/**
 * Delivers raw vendor responses for a source and window.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * - Each pagination page is returned as its own payload
 * - Transient vendor failures are retried inside the adapter
 * - A terminal failure raises SourceFetchException; the pipeline then fails
 *   that source only
 */
public interface SourceAdapter {

    /**
     * Whether this adapter can deliver payloads for the source.
     */
    boolean supports(String sourceId);

    List<SourcePayload> fetch(String sourceId, FetchWindow window);
}
