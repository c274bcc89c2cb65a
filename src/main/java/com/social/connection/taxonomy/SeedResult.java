package com.social.connection.taxonomy;

/**
 * Outcome of a taxonomy seed run.
 *
 * @param inserted  rules that did not exist before
 * @param updated   existing rules whose attributes changed
 * @param unchanged existing rules left as they were
 */
public record SeedResult(int inserted, int updated, int unchanged) {

    public int total() {
        return inserted + updated + unchanged;
    }
}
