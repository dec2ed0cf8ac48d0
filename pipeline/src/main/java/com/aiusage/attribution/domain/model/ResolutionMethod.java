package com.aiusage.attribution.domain.model;

/**
 * How a record's actor was attributed to a canonical user.
 */
public enum ResolutionMethod {
    DIRECT_EMAIL("direct_email"),
    KEY_MAPPING("key_mapping"),
    WORKSPACE_INFERENCE("workspace_inference"),
    UNRESOLVED("unresolved");

    private final String wireName;

    ResolutionMethod(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
