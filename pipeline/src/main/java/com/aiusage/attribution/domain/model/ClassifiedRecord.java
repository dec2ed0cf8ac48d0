package com.aiusage.attribution.domain.model;

import java.util.Objects;

/**
 * A raw record after identity resolution and platform classification.
 */
public record ClassifiedRecord(
        RawRecord record,
        ResolvedIdentity identity,
        PlatformCategory platform,
        double classificationConfidence,
        String classificationRule
) {

    public ClassifiedRecord {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(platform, "platform");
        if (Double.isNaN(classificationConfidence) || classificationConfidence < 0.0 || classificationConfidence > 1.0) {
            throw new IllegalArgumentException("classification confidence out of range: " + classificationConfidence);
        }
    }

    public ClassifiedRecord withRecord(RawRecord replacement) {
        return new ClassifiedRecord(replacement, identity, platform, classificationConfidence, classificationRule);
    }
}
