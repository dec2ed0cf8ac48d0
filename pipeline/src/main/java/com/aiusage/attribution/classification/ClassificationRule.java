package com.aiusage.attribution.classification;

import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;

import java.util.Optional;

/**
 * One signal for deciding a record's platform. Rules are tried in {@code @Order} order; the first match wins.
 */
public interface ClassificationRule {

    String name();

    Optional<Classification> classify(RawRecord record, ResolvedIdentity identity);
}
