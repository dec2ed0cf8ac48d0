package com.aiusage.attribution.domain.model;

/**
 * How a source's cost metric is turned into cost facts.
 */
public enum CostMode {
    /**
     * Cost amounts are billed amounts.
     */
    AUTHORITATIVE,

    /**
     * Cost amounts are vendor estimates and are stored flagged as such.
     */
    ESTIMATED,

    /**
     * Cost amounts are ignored; another source is the authority.
     */
    NONE
}
