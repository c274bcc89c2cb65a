package com.social.connection.taxonomy;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.SubRelationRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaxonomyLoader Tests")
class TaxonomyLoaderTest {

    private final TaxonomyLoader loader = new TaxonomyLoader();

    private static InputStream json(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Bundled taxonomy has three categories and 77 rules")
    void readsDefaults() {
        List<TaxonomyEntry> entries = loader.readDefaults();

        assertEquals(77, entries.size());
        assertEquals(36, entries.stream().filter(e -> e.category().equals("Relatives")).count());
        assertEquals(15, entries.stream().filter(e -> e.category().equals("Friend")).count());
        assertEquals(26, entries.stream().filter(e -> e.category().equals("Professional")).count());
    }

    @Test
    @DisplayName("Seeding the defaults maps legacy Universe to UNIVERSAL")
    void seedDefaults() {
        InMemoryTaxonomyStore store = new InMemoryTaxonomyStore();

        SeedResult first = loader.seedDefaults(store);
        SeedResult second = loader.seedDefaults(store);

        assertEquals(77, first.inserted());
        assertEquals(77, second.unchanged());
        SubRelationRule mentor = store.lookup("mentor").orElseThrow();
        assertEquals(Optional.of(BucketType.UNIVERSAL), mentor.getDefaultBucket());
        assertEquals("Mentee", mentor.getReverseLabel());
        assertEquals(Directionality.UNIDIRECTIONAL, store.lookup("friend").orElseThrow().getDirectionality());
    }

    @Test
    @DisplayName("approvalRequired defaults to true and unknown fields are ignored")
    void lenientFields() {
        List<TaxonomyEntry> entries = loader.read(json("""
                [{"category": "Friend", "name": "pal", "directionality": "Unidirectional",
                  "reverseLabel": "pal", "defaultBucket": "Outer", "comment": "ignored"}]
                """));

        assertEquals(1, entries.size());
        assertTrue(entries.get(0).approvalRequired());
        assertEquals(Optional.of(BucketType.OUTER), entries.get(0).toRule().getDefaultBucket());
    }

    @Test
    @DisplayName("Malformed content fails with UncheckedIOException")
    void malformed() {
        assertThrows(UncheckedIOException.class, () -> loader.read(json("{not an array")));
    }

    @Test
    @DisplayName("Missing resource fails with IllegalArgumentException")
    void missingResource() {
        assertThrows(IllegalArgumentException.class, () -> loader.readResource("/taxonomy/missing.json"));
    }
}
