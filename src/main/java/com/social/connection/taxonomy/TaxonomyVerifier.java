package com.social.connection.taxonomy;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.SubRelationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a seeded taxonomy for gaps that change engine behaviour: rules without a
 * default bucket, rules without a reverse label, and names that more than one
 * category defines (lookups by name then depend on seed order).
 */
public class TaxonomyVerifier {
    private static final Logger log = LoggerFactory.getLogger(TaxonomyVerifier.class);

    public TaxonomyReport verify(TaxonomyStore store) {
        Map<String, Integer> perCategory = new LinkedHashMap<>();
        List<String> missingBucket = new ArrayList<>();
        List<String> missingReverse = new ArrayList<>();
        Map<String, Set<String>> categoriesByName = new LinkedHashMap<>();
        Map<BucketType, Integer> buckets = new EnumMap<>(BucketType.class);
        Map<Directionality, Integer> directions = new EnumMap<>(Directionality.class);

        for (SubRelationRule rule : store.allRules()) {
            String category = rule.getCategory().name();
            String qualified = category + " -> " + rule.getName();
            perCategory.merge(category, 1, Integer::sum);
            directions.merge(rule.getDirectionality(), 1, Integer::sum);

            rule.getDefaultBucket().ifPresentOrElse(
                    bucket -> buckets.merge(bucket, 1, Integer::sum),
                    () -> missingBucket.add(qualified));
            if (rule.getReverseLabel().isEmpty()) {
                missingReverse.add(qualified);
            }
            categoriesByName
                    .computeIfAbsent(rule.getName().toLowerCase(Locale.ROOT), k -> new TreeSet<>())
                    .add(category.toLowerCase(Locale.ROOT));
        }

        List<String> ambiguous = categoriesByName.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(Map.Entry::getKey)
                .toList();

        TaxonomyReport report = new TaxonomyReport(perCategory, missingBucket, missingReverse,
                ambiguous, buckets, directions);
        if (report.isClean()) {
            log.info("taxonomy.verified rules={} clean=true", report.totalRules());
        } else {
            log.warn("taxonomy.verified rules={} missingDefaultBucket={} missingReverseLabel={} ambiguousNames={}",
                    report.totalRules(), missingBucket.size(), missingReverse.size(), ambiguous);
        }
        return report;
    }
}
