package com.aiusage.attribution.domain.model;

/**
 * Kinds of identity evidence a vendor payload may carry about the actor behind a record.
 */
public enum IdentityHint {
    /**
     * A user email address as reported by the vendor.
     */
    EMAIL("email"),

    /**
     * An opaque credential identifier (API key id or key name).
     */
    OPAQUE_KEY_ID("opaque_key_id"),

    /**
     * A vendor workspace identifier.
     */
    WORKSPACE_ID("workspace_id");

    private final String wireName;

    IdentityHint(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
