package com.aiusage.attribution.identity;

/**
 * Administrator-maintained owner of a vendor workspace. The owner may be a user email or a team id.
 */
public record WorkspaceMapping(String workspaceId, String ownerId, double confidence) {
}
