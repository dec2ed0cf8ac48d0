package com.aiusage.attribution.facts;

/**
 * Fact drafts of one source plus counts of what assembly dropped or combined.
 */
public record AssemblyResult(
        FactBatch batch,
        int unparseableSkipped,
        int duplicatesCollapsed,
        int overlapSuppressed,
        int collisionsSummed,
        int costAmountsIgnored
) {
}
