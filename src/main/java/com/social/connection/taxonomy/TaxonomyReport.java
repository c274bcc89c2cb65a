package com.social.connection.taxonomy;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;

import java.util.List;
import java.util.Map;

/**
 * Consistency report over the taxonomy.
 *
 * @param rulesPerCategory        category name to number of rules
 * @param missingDefaultBucket    "category -> name" of rules without a default bucket
 * @param missingReverseLabel     "category -> name" of rules without a reverse label
 * @param ambiguousNames          names defined by more than one category, lower-cased
 * @param bucketDistribution      default bucket to rule count; rules without one are not counted
 * @param directionalityDistribution directionality to rule count
 */
public record TaxonomyReport(Map<String, Integer> rulesPerCategory,
                             List<String> missingDefaultBucket,
                             List<String> missingReverseLabel,
                             List<String> ambiguousNames,
                             Map<BucketType, Integer> bucketDistribution,
                             Map<Directionality, Integer> directionalityDistribution) {

    public TaxonomyReport {
        rulesPerCategory = Map.copyOf(rulesPerCategory);
        missingDefaultBucket = List.copyOf(missingDefaultBucket);
        missingReverseLabel = List.copyOf(missingReverseLabel);
        ambiguousNames = List.copyOf(ambiguousNames);
        bucketDistribution = Map.copyOf(bucketDistribution);
        directionalityDistribution = Map.copyOf(directionalityDistribution);
    }

    public int totalRules() {
        return rulesPerCategory.values().stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * True when nothing needs attention.
     */
    public boolean isClean() {
        return missingDefaultBucket.isEmpty() && missingReverseLabel.isEmpty() && ambiguousNames.isEmpty();
    }
}
