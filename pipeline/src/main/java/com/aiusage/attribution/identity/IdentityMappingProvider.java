package com.aiusage.attribution.identity;

/**
 * Source of the current identity mapping snapshot.
 *
 * IMPLEMENTATION REQUIREMENTS:
 * - Never throw; an unavailable mapping degrades to an empty view
 * - Return the same snapshot for the whole run
 */
public interface IdentityMappingProvider {

    IdentityMappingView currentView();
}
