package com.aiusage.attribution.domain.model;

import java.util.Objects;

/**
 * Canonical user a record is attributed to, with the certainty of that attribution.
 *
 * INVARIANTS:
 * - confidence lies in [0, 1]
 * - DIRECT_EMAIL always carries confidence 1.0
 * - UNRESOLVED always carries the unattributed sentinel and confidence 0.0
 * - only KEY_MAPPING carries a mapped platform
 *
 * @param mappedPlatform platform the matched key is provisioned for, or null
 */
public record ResolvedIdentity(String canonicalUserId, double confidence, ResolutionMethod method,
                               PlatformCategory mappedPlatform) {

    public static final String UNATTRIBUTED = "unattributed";

    public ResolvedIdentity {
        Objects.requireNonNull(method, "method");
        if (canonicalUserId == null || canonicalUserId.isBlank()) {
            throw new IllegalArgumentException("canonicalUserId must not be blank");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
        if (method == ResolutionMethod.DIRECT_EMAIL && confidence != 1.0) {
            throw new IllegalArgumentException("direct email attribution must have confidence 1.0");
        }
        if (method == ResolutionMethod.UNRESOLVED
                && (!UNATTRIBUTED.equals(canonicalUserId) || confidence != 0.0)) {
            throw new IllegalArgumentException("unresolved identity must be unattributed with confidence 0.0");
        }
        if (method != ResolutionMethod.UNRESOLVED && UNATTRIBUTED.equals(canonicalUserId)) {
            throw new IllegalArgumentException("sentinel user id is reserved for unresolved identities");
        }
        if (mappedPlatform != null && method != ResolutionMethod.KEY_MAPPING) {
            throw new IllegalArgumentException("only key mappings carry a mapped platform");
        }
    }

    public ResolvedIdentity(String canonicalUserId, double confidence, ResolutionMethod method) {
        this(canonicalUserId, confidence, method, null);
    }

    public static ResolvedIdentity directEmail(String email) {
        return new ResolvedIdentity(email, 1.0, ResolutionMethod.DIRECT_EMAIL);
    }

    public static ResolvedIdentity keyMapping(String userId, double confidence) {
        return keyMapping(userId, confidence, null);
    }

    public static ResolvedIdentity keyMapping(String userId, double confidence, PlatformCategory platform) {
        return new ResolvedIdentity(userId, confidence, ResolutionMethod.KEY_MAPPING, platform);
    }

    public static ResolvedIdentity workspaceInference(String userId, double confidence) {
        return new ResolvedIdentity(userId, confidence, ResolutionMethod.WORKSPACE_INFERENCE);
    }

    public static ResolvedIdentity unresolved() {
        return new ResolvedIdentity(UNATTRIBUTED, 0.0, ResolutionMethod.UNRESOLVED);
    }

    public boolean isAttributed() {
        return method != ResolutionMethod.UNRESOLVED;
    }
}
