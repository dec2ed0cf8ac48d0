package com.aiusage.attribution.classification;

import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Assigns each record exactly one platform by trying the rules in priority order.
 * Records no rule recognizes fall back to UNKNOWN with confidence 0.
 */
@Component
@RequiredArgsConstructor
public class PlatformClassifier {

    private final List<ClassificationRule> rules;

    public Classification classify(RawRecord record, ResolvedIdentity identity) {
        for (ClassificationRule rule : rules) {
            Optional<Classification> result = rule.classify(record, identity);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return Classification.unknown();
    }
}
