package com.aiusage.attribution.domain.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of usage surfaces a record can be attributed to.
 */
public enum PlatformCategory {
    CURSOR("cursor", true),
    CLAUDE_CODE("claude_code", true),
    ANTHROPIC_API("anthropic_api", false),
    CLAUDE_AI("claude_ai", false),
    UNKNOWN("unknown", false);

    // Spellings seen in mapping sheets and vendor exports
    private static final Map<String, PlatformCategory> ALIASES = Map.ofEntries(
            Map.entry("cursor", CURSOR),
            Map.entry("claude_code", CLAUDE_CODE),
            Map.entry("claude-code", CLAUDE_CODE),
            Map.entry("anthropic_code", CLAUDE_CODE),
            Map.entry("anthropic_api", ANTHROPIC_API),
            Map.entry("anthropic", ANTHROPIC_API),
            Map.entry("api", ANTHROPIC_API),
            Map.entry("claude_ai", CLAUDE_AI),
            Map.entry("claude.ai", CLAUDE_AI),
            Map.entry("anthropic_web", CLAUDE_AI),
            Map.entry("unknown", UNKNOWN)
    );

    private final String wireName;
    private final boolean codingAgent;

    PlatformCategory(String wireName, boolean codingAgent) {
        this.wireName = wireName;
        this.codingAgent = codingAgent;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Whether the surface is an IDE or terminal coding agent.
     */
    public boolean isCodingAgent() {
        return codingAgent;
    }

    public static Optional<PlatformCategory> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(ALIASES.get(value.trim().toLowerCase(Locale.ROOT)));
    }
}
