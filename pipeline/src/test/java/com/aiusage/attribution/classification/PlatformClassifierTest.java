package com.aiusage.attribution.classification;

import com.aiusage.attribution.config.AttributionProperties;
import com.aiusage.attribution.domain.model.Dimensions;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.Metrics;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PlatformClassifier and its rules.
 *
 * Test strategy:
 * 1. Rule priority: explicit platform, key mapping platform, identifier pattern, metric shape, fallback
 * 2. Pattern confidence never exceeds identity confidence
 * 3. Exactly one category per record
 */
class PlatformClassifierTest {

    private static final Instant START = Instant.parse("2026-10-01T00:00:00Z");

    private PlatformClassifier classifier;

    @BeforeEach
    void setUp() {
        AttributionProperties properties = new AttributionProperties();
        AttributionProperties.IdentifierPattern claudeCodeKeys = new AttributionProperties.IdentifierPattern();
        claudeCodeKeys.setHint(IdentityHint.OPAQUE_KEY_ID);
        claudeCodeKeys.setPattern("(?i).*claude[-_]?code.*");
        claudeCodeKeys.setPlatform(PlatformCategory.CLAUDE_CODE);
        claudeCodeKeys.setReliability(0.9);
        properties.getClassification().setPatterns(List.of(claudeCodeKeys));
        properties.getClassification().setDefaultWorkspaceSources(Set.of("anthropic_cost"));
        properties.getClassification().setDefaultWorkspaceReliability(0.8);

        classifier = new PlatformClassifier(List.of(
                new ExplicitPlatformRule(),
                new KeyMappingPlatformRule(),
                new IdentifierPatternRule(properties),
                new MetricShapeRule()));
    }

    @Nested
    @DisplayName("Rule priority")
    class PriorityTests {

        @Test
        @DisplayName("Should trust an explicit platform with full confidence")
        void shouldTrustExplicitPlatform() {
            // Given
            RawRecord record = builder("cursor_daily_usage")
                    .dimensions(Map.of(Dimensions.PLATFORM, "cursor"))
                    .metricFields(Map.of(Metrics.LINES_ADDED, BigDecimal.TEN))
                    .build();

            // When
            Classification result = classifier.classify(record, ResolvedIdentity.directEmail("a@example.com"));

            // Then
            assertThat(result.category()).isEqualTo(PlatformCategory.CURSOR);
            assertThat(result.confidence()).isEqualTo(1.0);
            assertThat(result.rule()).isEqualTo("explicit_platform");
        }

        @Test
        @DisplayName("Should prefer an identifier pattern over the metric shape")
        void shouldPreferPatternOverShape() {
            RawRecord record = builder("anthropic_usage")
                    .identityHints(Map.of(IdentityHint.OPAQUE_KEY_ID, "claude-code-ci"))
                    .metricFields(Map.of(Metrics.INPUT_TOKENS, BigDecimal.TEN))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.keyMapping("a@example.com", 0.95));

            assertThat(result.category()).isEqualTo(PlatformCategory.CLAUDE_CODE);
            assertThat(result.confidence()).isEqualTo(0.9);
        }

        @Test
        @DisplayName("Should classify coding metrics as Claude Code")
        void shouldClassifyCodingMetrics() {
            RawRecord record = builder("unknown_source")
                    .metricFields(Map.of(Metrics.LINES_ADDED, BigDecimal.ONE, Metrics.COMMITS, BigDecimal.ONE))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.unresolved());

            assertThat(result.category()).isEqualTo(PlatformCategory.CLAUDE_CODE);
            assertThat(result.confidence()).isEqualTo(MetricShapeRule.CODING_CONFIDENCE);
        }

        @Test
        @DisplayName("Should classify token and web search counters as API traffic")
        void shouldClassifyTokenCounters() {
            RawRecord record = builder("unknown_source")
                    .metricFields(Map.of(
                            Metrics.INPUT_TOKENS, BigDecimal.TEN,
                            Metrics.WEB_SEARCH_REQUESTS, BigDecimal.ONE))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.unresolved());

            assertThat(result.category()).isEqualTo(PlatformCategory.ANTHROPIC_API);
            assertThat(result.confidence()).isEqualTo(MetricShapeRule.TOKENS_ONLY_CONFIDENCE);
        }

        @Test
        @DisplayName("Should fall back to UNKNOWN with zero confidence")
        void shouldFallBackToUnknown() {
            RawRecord record = builder("unknown_source")
                    .metricFields(Map.of(Metrics.EVENTS, BigDecimal.ONE))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.unresolved());

            assertThat(result).isEqualTo(Classification.unknown());
        }
    }

    @Nested
    @DisplayName("Identifier patterns")
    class IdentifierPatternTests {

        @Test
        @DisplayName("Should cap pattern confidence at the identity confidence")
        void shouldCapAtIdentityConfidence() {
            RawRecord record = builder("anthropic_usage")
                    .identityHints(Map.of(IdentityHint.OPAQUE_KEY_ID, "claude_code_key"))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.workspaceInference("a@example.com", 0.4));

            assertThat(result.category()).isEqualTo(PlatformCategory.CLAUDE_CODE);
            assertThat(result.confidence()).isEqualTo(0.4);
        }

        @Test
        @DisplayName("Should keep a pattern match on an unmapped key ahead of the metric shape, with zero confidence")
        void shouldKeepPatternMatchOnUnresolvedIdentity() {
            // Given
            RawRecord record = builder("anthropic_usage")
                    .identityHints(Map.of(IdentityHint.OPAQUE_KEY_ID, "claude_code_ci_key"))
                    .metricFields(Map.of(Metrics.INPUT_TOKENS, BigDecimal.TEN))
                    .build();

            // When
            Classification result = classifier.classify(record, ResolvedIdentity.unresolved());

            // Then
            assertThat(result.category()).isEqualTo(PlatformCategory.CLAUDE_CODE);
            assertThat(result.confidence()).isZero();
            assertThat(result.rule()).isEqualTo("identifier_pattern");
        }

        @Test
        @DisplayName("Should attribute rows without a workspace to the default API workspace")
        void shouldApplyDefaultWorkspace() {
            RawRecord record = builder("anthropic_cost")
                    .dimensions(Map.of(Dimensions.SCOPE, Dimensions.SCOPE_WORKSPACE, Dimensions.MODEL, "claude-opus-4"))
                    .metricFields(Map.of(Metrics.COST_MINOR_UNITS, BigDecimal.TEN))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.unresolved());

            assertThat(result.category()).isEqualTo(PlatformCategory.ANTHROPIC_API);
            assertThat(result.confidence()).isEqualTo(0.8);
        }

        @Test
        @DisplayName("Should not apply the default workspace to organization aggregates")
        void shouldSkipDefaultWorkspaceForAggregates() {
            RawRecord record = builder("anthropic_cost")
                    .dimensions(Map.of(Dimensions.SCOPE, Dimensions.SCOPE_ORGANIZATION))
                    .metricFields(Map.of(Metrics.COST_MINOR_UNITS, BigDecimal.TEN))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.unresolved());

            assertThat(result.category()).isEqualTo(PlatformCategory.UNKNOWN);
        }
    }

    @Nested
    @DisplayName("Key mapping platform")
    class KeyMappingPlatformTests {

        @Test
        @DisplayName("Should use the mapped key platform capped at the mapping confidence")
        void shouldUseMappedPlatform() {
            // Given
            RawRecord record = builder("anthropic_usage")
                    .identityHints(Map.of(IdentityHint.OPAQUE_KEY_ID, "claude_code_ci_key"))
                    .metricFields(Map.of(Metrics.INPUT_TOKENS, BigDecimal.TEN))
                    .build();
            ResolvedIdentity identity = ResolvedIdentity.keyMapping("a@example.com", 0.7, PlatformCategory.ANTHROPIC_API);

            // When
            Classification result = classifier.classify(record, identity);

            // Then
            assertThat(result.category()).isEqualTo(PlatformCategory.ANTHROPIC_API);
            assertThat(result.confidence()).isEqualTo(0.7);
            assertThat(result.rule()).isEqualTo("key_mapping_platform");
        }

        @Test
        @DisplayName("Should defer to an explicit platform on the record")
        void shouldDeferToExplicitPlatform() {
            RawRecord record = builder("cursor_daily_usage")
                    .dimensions(Map.of(Dimensions.PLATFORM, "cursor"))
                    .build();

            Classification result = classifier.classify(record,
                    ResolvedIdentity.keyMapping("a@example.com", 0.9, PlatformCategory.CLAUDE_CODE));

            assertThat(result.category()).isEqualTo(PlatformCategory.CURSOR);
        }

        @Test
        @DisplayName("Should fall through to identifier patterns when the mapping has no platform")
        void shouldFallThroughWithoutMappedPlatform() {
            RawRecord record = builder("anthropic_usage")
                    .identityHints(Map.of(IdentityHint.OPAQUE_KEY_ID, "claude-code-ci"))
                    .build();

            Classification result = classifier.classify(record, ResolvedIdentity.keyMapping("a@example.com", 0.95));

            assertThat(result.rule()).isEqualTo("identifier_pattern");
        }
    }

    private static RawRecord.RawRecordBuilder builder(String sourceId) {
        return RawRecord.builder()
                .sourceId(sourceId)
                .bucketStart(START)
                .bucketEnd(START.plusSeconds(86_400));
    }
}
