package com.social.connection.taxonomy;

import java.util.List;

/**
 * Small hand-written taxonomy shared by tests.
 */
public final class TaxonomyFixtures {

    private TaxonomyFixtures() {
    }

    public static TaxonomyEntry mentor() {
        return new TaxonomyEntry("Professional", "Mentor", "Bidirectional", true, "Mentee", "Universal");
    }

    public static TaxonomyEntry mentee() {
        return new TaxonomyEntry("Professional", "Mentee", "Bidirectional", true, "Mentor", "Universal");
    }

    public static TaxonomyEntry friend() {
        return new TaxonomyEntry("Friend", "friend", "Unidirectional", true, "friend", "Inner");
    }

    public static TaxonomyEntry bestFriend() {
        return new TaxonomyEntry("Friend", "Best Friend", "Unidirectional", true, "friend", "Inner");
    }

    public static TaxonomyEntry father() {
        return new TaxonomyEntry("Relatives", "father", "Bidirectional", true, "Child", "Inner");
    }

    public static TaxonomyEntry fan() {
        return new TaxonomyEntry("Professional", "Fan", "Unidirectional", false, "", "");
    }

    public static List<TaxonomyEntry> basic() {
        return List.of(father(), friend(), bestFriend(), mentor(), mentee());
    }

    public static InMemoryTaxonomyStore seededStore() {
        InMemoryTaxonomyStore store = new InMemoryTaxonomyStore();
        store.seed(basic());
        return store;
    }
}
