package com.social.connection.classification;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.ConnectionMessages;
import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.core.model.ParticipantState;
import com.social.connection.core.model.SubRelationRule;
import com.social.connection.taxonomy.TaxonomyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Derives per-participant labels and buckets from taxonomy rules.
 *
 * <p>For a rule chosen by one participant:</p>
 * <ul>
 *   <li>a bidirectional rule gives the other participant the rule's reverse label
 *       (mentor becomes mentee);</li>
 *   <li>a unidirectional rule gives the other participant the same label
 *       (friend stays friend).</li>
 * </ul>
 * Both participants start in the rule's default bucket.
 */
public class ClassificationEngine {
    private static final Logger log = LoggerFactory.getLogger(ClassificationEngine.class);

    private final TaxonomyStore taxonomy;

    public ClassificationEngine(TaxonomyStore taxonomy) {
        this.taxonomy = Objects.requireNonNull(taxonomy, "taxonomy is required");
    }

    /**
     * Looks up a rule by sub-relation name.
     *
     * @throws ConnectionException with kind NOT_FOUND if no category defines the name
     */
    public SubRelationRule requireRule(String subRelationName) {
        return taxonomy.lookup(subRelationName)
                .orElseThrow(() -> ConnectionException.notFound(
                        ConnectionMessages.SUB_RELATION_NOT_FOUND + subRelationName));
    }

    /**
     * Label the other participant receives when one side picks {@code chosenLabel}
     * under {@code rule}.
     */
    public String propagatedLabel(SubRelationRule rule, String chosenLabel) {
        return rule.isBidirectional() ? rule.getReverseLabel() : chosenLabel;
    }

    /**
     * Builds the classification of a new participant-variant connection.
     * The recipient's bucket is the forward rule's default; the reverse rule is not consulted.
     *
     * @throws ConnectionException with kind NOT_FOUND if the sub-relation is unknown
     */
    public ParticipantAssignment classify(String initiatorId, String recipientId, String subRelationName) {
        SubRelationRule rule = requireRule(subRelationName);
        BucketType bucket = rule.getDefaultBucket().orElse(null);
        String recipientLabel = propagatedLabel(rule, subRelationName);

        log.debug("Classified {} -> {} as '{}' / '{}' bucket={}",
                initiatorId, recipientId, subRelationName, recipientLabel, bucket);
        return ParticipantAssignment.of(subRelationName, rule.getDirectionality(),
                initiatorId, ParticipantState.initial(subRelationName, bucket),
                recipientId, ParticipantState.initial(recipientLabel, bucket));
    }

    /**
     * Applies a relabel chosen by {@code actorId}: the actor takes the new label (and the
     * new bucket when given) and is charged one modification; the other participant gets
     * the propagated label and keeps its bucket and count.
     *
     * @throws ConnectionException with kind NOT_FOUND if the sub-relation is unknown
     */
    public ParticipantAssignment relabel(ParticipantAssignment assignment, String actorId, String otherId,
                                         String newSubRelation, BucketType newBucket) {
        SubRelationRule rule = requireRule(newSubRelation);
        ParticipantState actor = assignment.stateOf(actorId);
        ParticipantState other = assignment.stateOf(otherId);
        return assignment
                .with(actorId, actor.relabelled(newSubRelation, newBucket))
                .with(otherId, other.withSubRelation(propagatedLabel(rule, newSubRelation)));
    }
}
