package com.social.connection.engine;

import com.social.connection.core.model.BucketAssignment;
import com.social.connection.stats.StatsDelta;

import java.util.Map;

/**
 * New assignment produced by a relabel, plus the stats deltas it implies per user.
 */
public record RelabelOutcome<A extends BucketAssignment>(A assignment, Map<String, StatsDelta> deltas) {

    public RelabelOutcome {
        deltas = Map.copyOf(deltas);
    }

    public static <A extends BucketAssignment> RelabelOutcome<A> withoutStats(A assignment) {
        return new RelabelOutcome<>(assignment, Map.of());
    }
}
