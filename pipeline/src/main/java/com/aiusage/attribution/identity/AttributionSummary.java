package com.aiusage.attribution.identity;

import com.aiusage.attribution.domain.model.ClassifiedRecord;
import com.aiusage.attribution.domain.model.IdentityHint;
import com.aiusage.attribution.domain.model.ResolutionMethod;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Attribution coverage of a batch of records.
 *
 * @param totalRecords       parseable records considered
 * @param byMethod           record count per resolution method
 * @param attributionRate    share of records attributed to a user
 * @param unmappedKeyIds     key ids that fell through the key mapping
 * @param lowConfidenceKeyIds key ids mapped with confidence below the review threshold
 */
public record AttributionSummary(
        long totalRecords,
        Map<ResolutionMethod, Long> byMethod,
        double attributionRate,
        SortedSet<String> unmappedKeyIds,
        SortedSet<String> lowConfidenceKeyIds
) {

    public static final double REVIEW_THRESHOLD = 0.8;

    public static AttributionSummary of(Collection<ClassifiedRecord> records) {
        Map<ResolutionMethod, Long> byMethod = new EnumMap<>(ResolutionMethod.class);
        SortedSet<String> unmapped = new TreeSet<>();
        SortedSet<String> lowConfidence = new TreeSet<>();
        long attributed = 0;

        for (ClassifiedRecord classified : records) {
            ResolutionMethod method = classified.identity().method();
            byMethod.merge(method, 1L, Long::sum);
            if (classified.identity().isAttributed()) {
                attributed++;
            }
            String keyId = classified.record().hint(IdentityHint.OPAQUE_KEY_ID).orElse(null);
            if (keyId == null) {
                continue;
            }
            if (method == ResolutionMethod.KEY_MAPPING) {
                if (classified.identity().confidence() < REVIEW_THRESHOLD) {
                    lowConfidence.add(keyId);
                }
            } else if (method != ResolutionMethod.DIRECT_EMAIL) {
                unmapped.add(keyId);
            }
        }

        double rate = records.isEmpty() ? 0.0 : (double) attributed / records.size();
        return new AttributionSummary(records.size(), byMethod, rate, unmapped, lowConfidence);
    }
}
