package com.aiusage.attribution.ingestion;

import java.util.Objects;

/**
 * One raw vendor response page, as delivered by a source adapter.
 *
 * @param sourceId     source the response belongs to
 * @param rawResponse  untransformed response body
 * @param fetchWindow  window the response was requested for
 * @param reference    where the page came from (file name, page cursor)
 */
public record SourcePayload(String sourceId, String rawResponse, FetchWindow fetchWindow, String reference) {

    public SourcePayload {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(fetchWindow, "fetchWindow");
        rawResponse = rawResponse == null ? "" : rawResponse;
    }
}
