package com.aiusage.attribution.classification;

import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Uses the platform the source states explicitly.
 */
@Component
@Order(1)
public class ExplicitPlatformRule implements ClassificationRule {

    @Override
    public String name() {
        return "explicit_platform";
    }

    @Override
    public Optional<Classification> classify(RawRecord record, ResolvedIdentity identity) {
        return record.dimension(Dimensions.PLATFORM)
                .flatMap(PlatformCategory::fromWireName)
                .filter(category -> category != PlatformCategory.UNKNOWN)
                .map(category -> new Classification(category, 1.0, name()));
    }
}
