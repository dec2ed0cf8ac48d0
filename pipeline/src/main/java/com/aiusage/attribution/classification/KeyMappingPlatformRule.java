package com.aiusage.attribution.classification;

import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolutionMethod;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Uses the platform recorded on the key mapping the identity was resolved through.
 * The result is never more certain than the mapping itself.
 */
@Component
@Order(2)
public class KeyMappingPlatformRule implements ClassificationRule {

    @Override
    public String name() {
        return "key_mapping_platform";
    }

    @Override
    public Optional<Classification> classify(RawRecord record, ResolvedIdentity identity) {
        if (identity.method() != ResolutionMethod.KEY_MAPPING) {
            return Optional.empty();
        }
        return Optional.ofNullable(identity.mappedPlatform())
                .filter(platform -> platform != PlatformCategory.UNKNOWN)
                .map(platform -> new Classification(platform, identity.confidence(), name()));
    }
}
