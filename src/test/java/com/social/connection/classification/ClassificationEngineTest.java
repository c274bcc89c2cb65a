package com.social.connection.classification;

import com.social.connection.core.ConnectionException;
import com.social.connection.core.ErrorKind;
import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.taxonomy.TaxonomyEntry;
import com.social.connection.taxonomy.TaxonomyFixtures;
import com.social.connection.taxonomy.InMemoryTaxonomyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ClassificationEngine Tests")
class ClassificationEngineTest {

    private InMemoryTaxonomyStore taxonomy;
    private ClassificationEngine engine;

    @BeforeEach
    void setUp() {
        taxonomy = TaxonomyFixtures.seededStore();
        engine = new ClassificationEngine(taxonomy);
    }

    @Nested
    @DisplayName("classify")
    class ClassifyTests {

        @Test
        @DisplayName("Bidirectional rule gives the recipient the reverse label")
        void mentorMentee() {
            ParticipantAssignment assignment = engine.classify("alice", "bob", "mentor");

            assertEquals("mentor", assignment.subRelationFor("alice"));
            assertEquals("Mentee", assignment.subRelationFor("bob"));
            assertEquals(BucketType.UNIVERSAL, assignment.bucketFor("alice"));
            assertEquals(BucketType.UNIVERSAL, assignment.bucketFor("bob"));
            assertEquals(Directionality.BIDIRECTIONAL, assignment.initialDirectionality());
            assertEquals(0, assignment.modificationCountOf("alice"));
            assertEquals(0, assignment.modificationCountOf("bob"));
        }

        @Test
        @DisplayName("Unidirectional rule copies the label to the recipient")
        void friendFriend() {
            ParticipantAssignment assignment = engine.classify("alice", "bob", "friend");

            assertEquals("friend", assignment.subRelationFor("alice"));
            assertEquals("friend", assignment.subRelationFor("bob"));
            assertEquals(BucketType.INNER, assignment.bucketFor("bob"));
        }

        @Test
        @DisplayName("Recipient uses the forward rule's bucket, not the reverse rule's")
        void forwardBucket() {
            taxonomy.seed(List.of(new TaxonomyEntry("Relatives", "Child", "Bidirectional", true, "father", "Outer")));

            ParticipantAssignment assignment = engine.classify("alice", "bob", "father");

            assertEquals("Child", assignment.subRelationFor("bob"));
            assertEquals(BucketType.INNER, assignment.bucketFor("bob"));
        }

        @Test
        @DisplayName("Rule without a default bucket leaves both buckets unset")
        void noBucket() {
            taxonomy.seed(List.of(TaxonomyFixtures.fan()));

            ParticipantAssignment assignment = engine.classify("alice", "bob", "Fan");

            assertNull(assignment.bucketFor("alice"));
            assertNull(assignment.bucketFor("bob"));
            assertEquals("Fan", assignment.subRelationFor("bob"));
        }

        @Test
        @DisplayName("Unknown sub-relation is NOT_FOUND")
        void unknown() {
            ConnectionException ex = assertThrows(ConnectionException.class,
                    () -> engine.classify("alice", "bob", "astronaut"));

            assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
            assertTrue(ex.getMessage().contains("astronaut"));
        }
    }

    @Nested
    @DisplayName("relabel")
    class RelabelTests {

        @Test
        @DisplayName("Actor takes the new label and is charged; the other side gets the propagated label")
        void relabelPropagates() {
            ParticipantAssignment initial = engine.classify("alice", "bob", "friend");

            ParticipantAssignment updated = engine.relabel(initial, "bob", "alice", "Mentee", BucketType.OUTER);

            assertEquals("Mentee", updated.subRelationFor("bob"));
            assertEquals(BucketType.OUTER, updated.bucketFor("bob"));
            assertEquals(1, updated.modificationCountOf("bob"));
            assertEquals("Mentor", updated.subRelationFor("alice"));
            assertEquals(BucketType.INNER, updated.bucketFor("alice"));
            assertEquals(0, updated.modificationCountOf("alice"));
        }

        @Test
        @DisplayName("Unknown sub-relation leaves the assignment unchanged")
        void relabelUnknown() {
            ParticipantAssignment initial = engine.classify("alice", "bob", "friend");

            ConnectionException ex = assertThrows(ConnectionException.class,
                    () -> engine.relabel(initial, "alice", "bob", "astronaut", null));

            assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
            assertEquals(0, initial.modificationCountOf("alice"));
        }
    }
}
