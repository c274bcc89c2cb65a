package com.social.connection.taxonomy;

import com.social.connection.cache.CacheConfig;
import com.social.connection.cache.CacheStats;
import com.social.connection.core.model.SubRelationRule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachingTaxonomyStore Tests")
class CachingTaxonomyStoreTest {

    @Mock
    private TaxonomyStore delegate;

    private CachingTaxonomyStore store;
    private SubRelationRule mentor;

    @BeforeEach
    void setUp() {
        store = new CachingTaxonomyStore(delegate, CacheConfig.defaults());
        mentor = TaxonomyFixtures.mentor().toRule();
    }

    @Test
    @DisplayName("Repeated lookups hit the delegate once, whatever the case")
    void cachesLookups() {
        when(delegate.lookup("mentor")).thenReturn(Optional.of(mentor));

        assertEquals(Optional.of(mentor), store.lookup("Mentor"));
        assertEquals(Optional.of(mentor), store.lookup("MENTOR "));

        verify(delegate, times(1)).lookup(anyString());
        CacheStats stats = store.getStats();
        assertEquals(1, stats.hitCount());
        assertEquals(1, stats.missCount());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    @Test
    @DisplayName("Misses are cached too")
    void cachesMisses() {
        when(delegate.lookup("astronaut")).thenReturn(Optional.empty());

        assertTrue(store.lookup("astronaut").isEmpty());
        assertTrue(store.lookup("astronaut").isEmpty());

        verify(delegate, times(1)).lookup("astronaut");
    }

    @Test
    @DisplayName("Blank names never reach the delegate")
    void blank() {
        assertTrue(store.lookup(" ").isEmpty());
        verifyNoInteractions(delegate);
    }

    @Test
    @DisplayName("Seeding clears the cache")
    void seedInvalidates() {
        when(delegate.lookup("mentor")).thenReturn(Optional.of(mentor));
        when(delegate.seed(anyCollection())).thenReturn(new SeedResult(0, 1, 0));

        store.lookup("mentor");
        store.seed(List.of(TaxonomyFixtures.mentor()));
        store.lookup("mentor");

        verify(delegate, times(2)).lookup("mentor");
    }

    @Test
    @DisplayName("Listing calls pass through")
    void passThrough() {
        when(delegate.allRules()).thenReturn(List.of(mentor));

        assertEquals(List.of(mentor), store.allRules());
        store.rulesOf("Professional");
        store.categories();

        verify(delegate).rulesOf("Professional");
        verify(delegate).categories();
    }
}
