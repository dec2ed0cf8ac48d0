package com.aiusage.attribution.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolvedIdentityTest {

    @Test
    @DisplayName("Should give direct email attributions full confidence")
    void shouldGiveDirectEmailFullConfidence() {
        ResolvedIdentity identity = ResolvedIdentity.directEmail("alice@example.com");

        assertThat(identity.confidence()).isEqualTo(1.0);
        assertThat(identity.isAttributed()).isTrue();
    }

    @Test
    @DisplayName("Should use the sentinel user for unresolved identities")
    void shouldUseSentinelForUnresolved() {
        ResolvedIdentity identity = ResolvedIdentity.unresolved();

        assertThat(identity.canonicalUserId()).isEqualTo(ResolvedIdentity.UNATTRIBUTED);
        assertThat(identity.confidence()).isZero();
        assertThat(identity.isAttributed()).isFalse();
    }

    @Test
    @DisplayName("Should reject confidences outside [0, 1]")
    void shouldRejectOutOfRangeConfidence() {
        assertThatThrownBy(() -> ResolvedIdentity.keyMapping("alice@example.com", 1.2))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResolvedIdentity.workspaceInference("alice@example.com", -0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ResolvedIdentity.keyMapping("alice@example.com", Double.NaN))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should reserve the sentinel user for unresolved identities")
    void shouldReserveSentinel() {
        assertThatThrownBy(() -> ResolvedIdentity.keyMapping(ResolvedIdentity.UNATTRIBUTED, 0.9))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ResolvedIdentity("alice@example.com", 0.9, ResolutionMethod.DIRECT_EMAIL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should only let key mappings carry a mapped platform")
    void shouldRestrictMappedPlatformToKeyMappings() {
        assertThat(ResolvedIdentity.keyMapping("alice@example.com", 0.9, PlatformCategory.CLAUDE_CODE).mappedPlatform())
                .isEqualTo(PlatformCategory.CLAUDE_CODE);
        assertThatThrownBy(() -> new ResolvedIdentity("alice@example.com", 0.4, ResolutionMethod.WORKSPACE_INFERENCE,
                PlatformCategory.CLAUDE_CODE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
