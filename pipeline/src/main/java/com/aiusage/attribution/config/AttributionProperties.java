package com.aiusage.attribution.config;

import com.aiusage.attribution.domain.model.CostMode;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.PlatformCategory;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structured pipeline settings bound from the {@code attribution} prefix.
 *
 * Source ids contain underscores, so map keys must use bracket notation in YAML,
 * e.g. {@code sources: "[claude_code_usage]": ...}.
 */
@ConfigurationProperties(prefix = "attribution")
@Validated
@Getter
@Setter
public class AttributionProperties {

    /**
     * Per-source settings keyed by source id. Unlisted sources use the defaults.
     */
    @Valid
    private Map<String, SourceSettings> sources = new LinkedHashMap<>();

    /**
     * Sources run when the command line names none. Empty means every registered source.
     */
    private List<String> defaultSources = new ArrayList<>();

    @Valid
    private Identity identity = new Identity();

    @Valid
    private Classification classification = new Classification();

    public CostMode costModeFor(String sourceId) {
        SourceSettings settings = sources.get(sourceId);
        return settings == null ? CostMode.AUTHORITATIVE : settings.getCostMode();
    }

    public boolean isEnabled(String sourceId) {
        SourceSettings settings = sources.get(sourceId);
        return settings == null || settings.isEnabled();
    }

    @Getter
    @Setter
    public static class SourceSettings {
        @NotNull
        private CostMode costMode = CostMode.AUTHORITATIVE;
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Identity {
        /**
         * Alias domain to primary domain, e.g. {@code corp-old.com: corp.com}.
         */
        private Map<String, String> aliasDomains = new HashMap<>();
    }

    @Getter
    @Setter
    public static class Classification {
        @Valid
        private List<IdentifierPattern> patterns = new ArrayList<>();

        /**
         * Sources whose rows without a workspace id belong to the default API workspace.
         */
        private Set<String> defaultWorkspaceSources = new HashSet<>();

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double defaultWorkspaceReliability = 0.8;
    }

    @Getter
    @Setter
    public static class IdentifierPattern {
        @NotNull
        private IdentityHint hint;
        @NotBlank
        private String pattern;
        @NotNull
        private PlatformCategory platform;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double reliability = 0.9;
    }
}
