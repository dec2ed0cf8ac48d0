package com.aiusage.attribution.classification;

import com.aiusage.attribution.config.AttributionProperties;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers the platform from key and workspace identifiers.
 *
 * CONFIDENCE:
 * A pattern match is keyed on an identity hint, so the result is never more
 * certain than the identity: min(pattern reliability, identity confidence).
 * A match on an unresolved identity still decides the platform, with confidence 0.
 *
 * DEFAULT WORKSPACE:
 * For workspace-scoped sources, a breakdown row without a workspace id belongs
 * to the default workspace, which only serves direct API traffic.
 */
@Component
@Order(3)
@Slf4j
public class IdentifierPatternRule implements ClassificationRule {

    private final List<CompiledPattern> patterns;
    private final Set<String> defaultWorkspaceSources;
    private final double defaultWorkspaceReliability;

    public IdentifierPatternRule(AttributionProperties properties) {
        AttributionProperties.Classification settings = properties.getClassification();
        this.patterns = settings.getPatterns().stream()
                .map(p -> new CompiledPattern(p.getHint(), Pattern.compile(p.getPattern()), p.getPlatform(), p.getReliability()))
                .toList();
        this.defaultWorkspaceSources = Set.copyOf(settings.getDefaultWorkspaceSources());
        this.defaultWorkspaceReliability = settings.getDefaultWorkspaceReliability();
        log.info("Loaded {} identifier pattern(s); default workspace sources: {}", patterns.size(), defaultWorkspaceSources);
    }

    @Override
    public String name() {
        return "identifier_pattern";
    }

    @Override
    public Optional<Classification> classify(RawRecord record, ResolvedIdentity identity) {
        for (CompiledPattern pattern : patterns) {
            Optional<String> value = record.hint(pattern.hint());
            if (value.isEmpty() || !pattern.regex().matcher(value.get()).matches()) {
                continue;
            }
            double confidence = Math.min(pattern.reliability(), identity.confidence());
            return Optional.of(new Classification(pattern.platform(), confidence, name()));
        }

        if (defaultWorkspaceSources.contains(record.sourceId())
                && record.hint(IdentityHint.WORKSPACE_ID).isEmpty()
                && !record.isOrganizationAggregate()) {
            return Optional.of(new Classification(PlatformCategory.ANTHROPIC_API, defaultWorkspaceReliability, name()));
        }
        return Optional.empty();
    }

    private record CompiledPattern(IdentityHint hint, Pattern regex, PlatformCategory platform, double reliability) {
    }
}
