package com.social.connection.taxonomy;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.social.connection.cache.CacheConfig;
import com.social.connection.cache.CacheStats;
import com.social.connection.core.model.RelationCategory;
import com.social.connection.core.model.SubRelationRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Caffeine-backed decorator that caches {@link #lookup(String)} results, misses included.
 * Every {@link #seed(Collection)} clears the cache.
 */
public class CachingTaxonomyStore implements TaxonomyStore {
    private static final Logger log = LoggerFactory.getLogger(CachingTaxonomyStore.class);

    private final TaxonomyStore delegate;
    private final Cache<String, Optional<SubRelationRule>> lookups;

    public CachingTaxonomyStore(TaxonomyStore delegate, CacheConfig config) {
        this.delegate = delegate;
        this.lookups = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("Taxonomy cache initialized: maxSize={}, ttl={}", config.maxSize(), config.ttl());
    }

    @Override
    public Optional<SubRelationRule> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return lookups.get(name.trim().toLowerCase(Locale.ROOT), key -> delegate.lookup(key));
    }

    @Override
    public SeedResult seed(Collection<TaxonomyEntry> entries) {
        try {
            return delegate.seed(entries);
        } finally {
            lookups.invalidateAll();
            log.debug("Taxonomy cache cleared after seed");
        }
    }

    @Override
    public List<RelationCategory> categories() {
        return delegate.categories();
    }

    @Override
    public List<SubRelationRule> rulesOf(String categoryName) {
        return delegate.rulesOf(categoryName);
    }

    @Override
    public List<SubRelationRule> allRules() {
        return delegate.allRules();
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = lookups.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), lookups.estimatedSize());
    }
}
