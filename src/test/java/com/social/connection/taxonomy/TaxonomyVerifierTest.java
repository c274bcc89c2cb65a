package com.social.connection.taxonomy;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TaxonomyVerifier Tests")
class TaxonomyVerifierTest {

    private final TaxonomyVerifier verifier = new TaxonomyVerifier();

    @Test
    @DisplayName("A complete taxonomy is clean")
    void clean() {
        TaxonomyReport report = verifier.verify(TaxonomyFixtures.seededStore());

        assertTrue(report.isClean());
        assertEquals(5, report.totalRules());
        assertEquals(2, report.rulesPerCategory().get("Friend"));
        assertEquals(2, report.bucketDistribution().get(BucketType.UNIVERSAL));
        assertEquals(3, report.directionalityDistribution().get(Directionality.BIDIRECTIONAL));
    }

    @Test
    @DisplayName("Reports missing buckets, missing reverse labels and ambiguous names")
    void gaps() {
        InMemoryTaxonomyStore store = TaxonomyFixtures.seededStore();
        store.seed(List.of(
                TaxonomyFixtures.fan(),
                new TaxonomyEntry("Professional", "Friend", "Unidirectional", true, "friend", "Outer")));

        TaxonomyReport report = verifier.verify(store);

        assertFalse(report.isClean());
        assertEquals(List.of("Professional -> Fan"), report.missingDefaultBucket());
        assertEquals(List.of("Professional -> Fan"), report.missingReverseLabel());
        assertEquals(List.of("friend"), report.ambiguousNames());
        assertEquals(7, report.totalRules());
    }

    @Test
    @DisplayName("The bundled taxonomy has no ambiguous names")
    void bundled() {
        InMemoryTaxonomyStore store = new InMemoryTaxonomyStore();
        new TaxonomyLoader().seedDefaults(store);

        TaxonomyReport report = verifier.verify(store);

        assertEquals(77, report.totalRules());
        assertTrue(report.ambiguousNames().isEmpty());
        assertTrue(report.missingDefaultBucket().isEmpty());
        assertFalse(report.missingReverseLabel().isEmpty());
    }
}
