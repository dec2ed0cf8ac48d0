package com.aiusage.attribution.identity;

import com.aiusage.attribution.adapters.JsonFields;
import com.aiusage.attribution.domain.model.PlatformCategory;
import com.aiusage.attribution.normalization.EmailNormalizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the identity mapping from the JSON export of the administrators' mapping sheet.
 *
 * FILE FORMAT:
 * <pre>
 * { "version": "...",
 *   "keys": [ { "key_id" | "api_key_name", "email", "description", "platform", "confidence", "active" } ],
 *   "workspaces": [ { "workspace_id", "owner", "confidence" } ] }
 * </pre>
 * Rows with an invalid email or an out-of-range confidence are skipped with a warning.
 * The snapshot is cached; an unreadable file yields an empty view.
 */
@Component
@Slf4j
public class JsonFileIdentityMappingProvider implements IdentityMappingProvider {

    static final double DEFAULT_KEY_CONFIDENCE = 0.9;
    static final double DEFAULT_WORKSPACE_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;
    private final EmailNormalizer emailNormalizer;
    private final String mappingFile;

    public JsonFileIdentityMappingProvider(
            ObjectMapper objectMapper,
            EmailNormalizer emailNormalizer,
            @Value("${attribution.identity.mapping-file:}") String mappingFile) {
        this.objectMapper = objectMapper;
        this.emailNormalizer = emailNormalizer;
        this.mappingFile = mappingFile;
    }

    @Override
    @Cacheable(cacheNames = "identity-mappings", key = "'current'")
    public IdentityMappingView currentView() {
        if (mappingFile == null || mappingFile.isBlank()) {
            log.warn("No identity mapping file configured; key and workspace attribution disabled");
            return IdentityMappingView.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(Files.readString(Path.of(mappingFile)));
            IdentityMappingView view = parse(root);
            log.info("Loaded identity mapping version {} with {} key mapping(s)", view.version(), view.keyCount());
            return view;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load identity mapping from {}: {}. Using empty mapping", mappingFile, e.getMessage());
            return IdentityMappingView.empty();
        }
    }

    @CacheEvict(cacheNames = "identity-mappings", allEntries = true)
    public void refresh() {
        log.info("Identity mapping cache evicted");
    }

    private IdentityMappingView parse(JsonNode root) {
        List<KeyMapping> keys = new ArrayList<>();
        for (JsonNode row : root.path("keys")) {
            String keyId = JsonFields.text(row, "key_id");
            if (keyId == null) {
                keyId = JsonFields.text(row, "api_key_name");
            }
            String email = emailNormalizer.normalize(JsonFields.text(row, "email")).orElse(null);
            double confidence = confidence(row, DEFAULT_KEY_CONFIDENCE);
            if (keyId == null || email == null || Double.isNaN(confidence)) {
                log.warn("Skipping invalid key mapping row: {}", row);
                continue;
            }
            boolean active = !row.has("active") || row.path("active").asBoolean(true);
            PlatformCategory platform = PlatformCategory.fromWireName(JsonFields.text(row, "platform")).orElse(null);
            keys.add(new KeyMapping(keyId, email, JsonFields.text(row, "description"), platform, confidence, active));
        }

        List<WorkspaceMapping> workspaces = new ArrayList<>();
        for (JsonNode row : root.path("workspaces")) {
            String workspaceId = JsonFields.text(row, "workspace_id");
            String owner = JsonFields.text(row, "owner");
            double confidence = confidence(row, DEFAULT_WORKSPACE_CONFIDENCE);
            if (workspaceId == null || owner == null || Double.isNaN(confidence)) {
                log.warn("Skipping invalid workspace mapping row: {}", row);
                continue;
            }
            workspaces.add(new WorkspaceMapping(workspaceId, emailNormalizer.normalize(owner).orElse(owner), confidence));
        }

        String version = JsonFields.text(root, "version");
        return new InMemoryIdentityMappingView(version == null ? "unversioned" : version, Instant.now(), keys, workspaces);
    }

    private static double confidence(JsonNode row, double defaultValue) {
        BigDecimal value = JsonFields.decimal(row, "confidence");
        if (value == null) {
            return defaultValue;
        }
        double confidence = value.doubleValue();
        return confidence < 0.0 || confidence > 1.0 ? Double.NaN : confidence;
    }
}
