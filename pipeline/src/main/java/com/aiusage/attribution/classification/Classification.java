package com.aiusage.attribution.classification;

import com.aiusage.attribution.domain.model.PlatformCategory;

import java.util.Objects;

/**
 * Platform assigned to a record, with the rule that assigned it.
 */
public record Classification(PlatformCategory category, double confidence, String rule) {

    public static final String FALLBACK_RULE = "fallback";

    public Classification {
        Objects.requireNonNull(category, "category");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
    }

    public static Classification unknown() {
        return new Classification(PlatformCategory.UNKNOWN, 0.0, FALLBACK_RULE);
    }
}
