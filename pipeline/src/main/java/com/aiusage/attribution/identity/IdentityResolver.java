package com.aiusage.attribution.identity;

import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.RawRecord;
import com.aiusage.attribution.domain.model.ResolvedIdentity;
import com.aiusage.attribution.normalization.EmailNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Attributes a raw record to a canonical user.
 *
 * PRECEDENCE (first usable hint wins):
 * 1. Email hint: confidence 1.0
 * 2. Key id present in the mapping and active: the entry's confidence
 * 3. Workspace id present in the mapping: the entry's confidence, capped
 * 4. Unresolved
 *
 * A key mapping beats workspace inference whatever their confidences. Workspace
 * inference never exceeds the cap, and the cap itself never exceeds 0.5. Mapping
 * rows with an unusable email or owner are skipped.
 */
@Component
@Slf4j
public class IdentityResolver {

    static final double MAX_WORKSPACE_CONFIDENCE = 0.5;

    private final EmailNormalizer emailNormalizer;
    private final double workspaceConfidenceCap;

    public IdentityResolver(
            EmailNormalizer emailNormalizer,
            @Value("${attribution.identity.workspace-confidence-cap:0.5}") double workspaceConfidenceCap) {
        this.emailNormalizer = emailNormalizer;
        this.workspaceConfidenceCap = Math.max(0.0, Math.min(workspaceConfidenceCap, MAX_WORKSPACE_CONFIDENCE));
    }

    public ResolvedIdentity resolve(RawRecord record, IdentityMappingView mapping) {
        IdentityMappingView view = mapping == null ? IdentityMappingView.empty() : mapping;

        Optional<String> email = record.hint(IdentityHint.EMAIL).flatMap(emailNormalizer::normalize);
        if (email.isPresent()) {
            return ResolvedIdentity.directEmail(email.get());
        }

        Optional<ResolvedIdentity> byKey = record.hint(IdentityHint.OPAQUE_KEY_ID)
                .flatMap(view::findByKey)
                .filter(KeyMapping::active)
                .flatMap(this::fromKeyMapping);
        if (byKey.isPresent()) {
            return byKey.get();
        }

        Optional<ResolvedIdentity> byWorkspace = record.hint(IdentityHint.WORKSPACE_ID)
                .flatMap(view::findByWorkspace)
                .flatMap(this::fromWorkspaceMapping);
        if (byWorkspace.isPresent()) {
            return byWorkspace.get();
        }

        log.debug("Unresolved identity for {} record with hints {}", record.sourceId(), record.identityHints());
        return ResolvedIdentity.unresolved();
    }

    private Optional<ResolvedIdentity> fromKeyMapping(KeyMapping mapping) {
        return emailNormalizer.normalize(mapping.email())
                .map(email -> ResolvedIdentity.keyMapping(email, clamp(mapping.confidence()), mapping.platform()));
    }

    private Optional<ResolvedIdentity> fromWorkspaceMapping(WorkspaceMapping mapping) {
        String rawOwner = mapping.ownerId();
        if (rawOwner == null || rawOwner.isBlank()) {
            log.warn("Ignoring workspace mapping {} without an owner", mapping.workspaceId());
            return Optional.empty();
        }
        String owner = emailNormalizer.normalize(rawOwner).orElseGet(rawOwner::trim);
        if (ResolvedIdentity.UNATTRIBUTED.equals(owner)) {
            log.warn("Ignoring workspace mapping {} owned by the unattributed sentinel", mapping.workspaceId());
            return Optional.empty();
        }
        return Optional.of(ResolvedIdentity.workspaceInference(owner,
                Math.min(clamp(mapping.confidence()), workspaceConfidenceCap)));
    }

    private static double clamp(double confidence) {
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
