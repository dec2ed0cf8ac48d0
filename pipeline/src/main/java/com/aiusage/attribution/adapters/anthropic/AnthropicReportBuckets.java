package com.aiusage.attribution.adapters.anthropic;

import com.aiusage.attribution.adapters.JsonFields;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Time bucket of an Admin API report page entry ({@code starting_at}, {@code ending_at}).
 */
record AnthropicReportBuckets(Instant start, Instant end) {

    static AnthropicReportBuckets of(JsonNode bucket) {
        Instant start = JsonFields.instant(bucket, "starting_at");
        Instant end = JsonFields.instant(bucket, "ending_at");
        if (start == null || end == null) {
            throw new IllegalArgumentException("bucket without starting_at/ending_at");
        }
        return new AnthropicReportBuckets(start, end);
    }
}
