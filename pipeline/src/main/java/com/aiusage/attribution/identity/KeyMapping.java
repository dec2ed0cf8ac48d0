package com.aiusage.attribution.identity;

import com.aiusage.attribution.domain.model.PlatformCategory;

/**
 * Administrator-maintained assignment of an API key to a user.
 *
 * @param keyId       key id or key name as reported by the vendor
 * @param email       owning user's email
 * @param description free text from the mapping sheet
 * @param platform    platform the key is provisioned for, when known
 * @param confidence  how sure the administrator is of the assignment
 * @param active      inactive rows are kept for history but never used
 */
public record KeyMapping(
        String keyId,
        String email,
        String description,
        PlatformCategory platform,
        double confidence,
        boolean active
) {
}
