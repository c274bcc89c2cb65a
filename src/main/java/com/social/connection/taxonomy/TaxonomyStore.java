package com.social.connection.taxonomy;

import com.social.connection.core.model.RelationCategory;
import com.social.connection.core.model.SubRelationRule;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Reference data for relationship labels.
 *
 * <p>Rules are keyed by (category, name). Request-time code only reads; writes happen
 * through {@link #seed(Collection)}, which is idempotent.</p>
 */
public interface TaxonomyStore {

    /**
     * Finds a rule by sub-relation name, case-insensitively, across all categories.
     * If two categories define the same name the first one in store order wins.
     *
     * @param name the sub-relation name
     * @return the rule, or empty if no category defines it
     */
    Optional<SubRelationRule> lookup(String name);

    /**
     * Finds the category that defines the given sub-relation.
     */
    default Optional<RelationCategory> categoryOf(String subRelationName) {
        return lookup(subRelationName).map(SubRelationRule::getCategory);
    }

    /**
     * Inserts or updates rules keyed by (category, name). Existing connections that
     * reference a changed rule are not touched.
     *
     * @param entries seed rows
     * @return counts of inserted, updated and unchanged rules
     */
    SeedResult seed(Collection<TaxonomyEntry> entries);

    /**
     * All categories, in store order.
     */
    List<RelationCategory> categories();

    /**
     * Rules of one category (case-insensitive category name), in store order.
     */
    List<SubRelationRule> rulesOf(String categoryName);

    /**
     * All rules, in store order.
     */
    List<SubRelationRule> allRules();
}
