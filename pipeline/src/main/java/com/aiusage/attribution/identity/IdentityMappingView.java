package com.aiusage.attribution.identity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, versioned snapshot of the identity mapping. The pipeline only reads it.
 */
public interface IdentityMappingView {

    Optional<KeyMapping> findByKey(String keyId);

    Optional<WorkspaceMapping> findByWorkspace(String workspaceId);

    String version();

    Instant loadedAt();

    int keyCount();

    static IdentityMappingView empty() {
        return new InMemoryIdentityMappingView("empty", Instant.EPOCH, List.of(), List.of());
    }
}
