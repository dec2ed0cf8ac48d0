package com.aiusage.attribution.identity;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed mapping snapshot. Later entries win on duplicate ids.
 */
public class InMemoryIdentityMappingView implements IdentityMappingView {

    private final String version;
    private final Instant loadedAt;
    private final Map<String, KeyMapping> keys;
    private final Map<String, WorkspaceMapping> workspaces;

    public InMemoryIdentityMappingView(String version, Instant loadedAt,
                                       Collection<KeyMapping> keyMappings,
                                       Collection<WorkspaceMapping> workspaceMappings) {
        this.version = version;
        this.loadedAt = loadedAt;
        Map<String, KeyMapping> keyIndex = new HashMap<>();
        keyMappings.forEach(mapping -> keyIndex.put(mapping.keyId().trim(), mapping));
        Map<String, WorkspaceMapping> workspaceIndex = new HashMap<>();
        workspaceMappings.forEach(mapping -> workspaceIndex.put(mapping.workspaceId().trim(), mapping));
        this.keys = Map.copyOf(keyIndex);
        this.workspaces = Map.copyOf(workspaceIndex);
    }

    @Override
    public Optional<KeyMapping> findByKey(String keyId) {
        return keyId == null ? Optional.empty() : Optional.ofNullable(keys.get(keyId.trim()));
    }

    @Override
    public Optional<WorkspaceMapping> findByWorkspace(String workspaceId) {
        return workspaceId == null ? Optional.empty() : Optional.ofNullable(workspaces.get(workspaceId.trim()));
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public Instant loadedAt() {
        return loadedAt;
    }

    @Override
    public int keyCount() {
        return keys.size();
    }
}
