package com.social.connection.taxonomy;

import com.social.connection.core.model.RelationCategory;
import com.social.connection.core.model.SubRelationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory implementation of {@link TaxonomyStore}.
 * Keeps insertion order, so ambiguous names resolve to the first seeded category.
 */
public class InMemoryTaxonomyStore implements TaxonomyStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryTaxonomyStore.class);

    private final Map<RuleKey, SubRelationRule> rules = new LinkedHashMap<>();

    @Override
    public synchronized Optional<SubRelationRule> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return rules.values().stream()
                .filter(rule -> rule.hasName(name))
                .findFirst();
    }

    @Override
    public synchronized SeedResult seed(Collection<TaxonomyEntry> entries) {
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (TaxonomyEntry entry : entries) {
            SubRelationRule rule = entry.toRule();
            RuleKey key = RuleKey.of(rule.getCategory().name(), rule.getName());
            SubRelationRule existing = rules.get(key);
            if (existing == null) {
                rules.put(key, rule);
                inserted++;
                continue;
            }
            // keep the originally seeded spelling of category and name
            SubRelationRule candidate = rule.toBuilder()
                    .category(existing.getCategory())
                    .name(existing.getName())
                    .build();
            if (!existing.equals(candidate)) {
                rules.put(key, candidate);
                updated++;
            } else {
                unchanged++;
            }
        }
        log.info("taxonomy.seeded inserted={} updated={} unchanged={}", inserted, updated, unchanged);
        return new SeedResult(inserted, updated, unchanged);
    }

    @Override
    public synchronized List<RelationCategory> categories() {
        Set<RelationCategory> categories = new LinkedHashSet<>();
        rules.values().forEach(rule -> categories.add(rule.getCategory()));
        return List.copyOf(categories);
    }

    @Override
    public synchronized List<SubRelationRule> rulesOf(String categoryName) {
        List<SubRelationRule> result = new ArrayList<>();
        for (SubRelationRule rule : rules.values()) {
            if (rule.getCategory().name().equalsIgnoreCase(categoryName)) {
                result.add(rule);
            }
        }
        return result;
    }

    @Override
    public synchronized List<SubRelationRule> allRules() {
        return List.copyOf(rules.values());
    }

    record RuleKey(String category, String name) {
        static RuleKey of(String category, String name) {
            return new RuleKey(category.trim().toLowerCase(Locale.ROOT), name.trim().toLowerCase(Locale.ROOT));
        }
    }
}
