package com.aiusage.attribution.classification;

import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Guesses the platform from which metrics a record carries.
 *
 * Coding fields only come from coding agents; a record with token counters and
 * nothing else looks like direct API traffic.
 */
@Component
@Order(4)
public class MetricShapeRule implements ClassificationRule {

    static final double CODING_CONFIDENCE = 0.6;
    static final double TOKENS_ONLY_CONFIDENCE = 0.5;

    @Override
    public String name() {
        return "metric_shape";
    }

    @Override
    public Optional<Classification> classify(RawRecord record, ResolvedIdentity identity) {
        Set<String> fields = record.metricFields().keySet();
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        if (fields.stream().anyMatch(Metrics.CODING_FIELDS::contains)) {
            return Optional.of(new Classification(PlatformCategory.CLAUDE_CODE, CODING_CONFIDENCE, name()));
        }
        if (fields.stream().anyMatch(Metrics.TOKEN_FIELDS::contains)
                && Metrics.API_REQUEST_FIELDS.containsAll(fields)) {
            return Optional.of(new Classification(PlatformCategory.ANTHROPIC_API, TOKENS_ONLY_CONFIDENCE, name()));
        }
        return Optional.empty();
    }
}
