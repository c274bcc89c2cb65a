package com.social.connection.stats;

import com.social.connection.core.model.BucketType;
import com.social.connection.core.model.Connection;
import com.social.connection.core.model.ConnectionStatus;
import com.social.connection.core.model.Directionality;
import com.social.connection.core.model.ParticipantAssignment;
import com.social.connection.core.model.ParticipantState;
import com.social.connection.core.model.SharedAssignment;
import com.social.connection.store.InMemoryConnectionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatsAggregator Tests")
class StatsAggregatorTest {

    private InMemoryConnectionRepository<SharedAssignment> shared;
    private InMemoryConnectionRepository<ParticipantAssignment> participant;
    private StatsAggregator aggregator;

    @BeforeEach
    void setUp() {
        shared = new InMemoryConnectionRepository<>();
        participant = new InMemoryConnectionRepository<>();
        aggregator = new StatsAggregator(new InMemoryStatsRepository(), List.of(shared, participant));
    }

    private void sharedConnection(String from, String to, ConnectionStatus status) {
        shared.save(Connection.<SharedAssignment>builder()
                .initiatorId(from).recipientId(to).status(status)
                .assignment(new SharedAssignment(BucketType.INNER, "Friend", "friend"))
                .build());
    }

    private void participantConnection(String from, String to, ConnectionStatus status) {
        participant.save(Connection.<ParticipantAssignment>builder()
                .initiatorId(from).recipientId(to).status(status)
                .assignment(ParticipantAssignment.of("friend", Directionality.UNIDIRECTIONAL,
                        from, ParticipantState.initial("friend", BucketType.INNER),
                        to, ParticipantState.initial("friend", BucketType.INNER)))
                .build());
    }

    @Nested
    @DisplayName("Sent and received refresh")
    class RefreshTests {

        @Test
        @DisplayName("Counts from both variants; received means pending only")
        void countsBothVariants() {
            sharedConnection("alice", "bob", ConnectionStatus.RECEIVED);
            participantConnection("alice", "carol", ConnectionStatus.ACCEPTED);
            sharedConnection("carol", "alice", ConnectionStatus.RECEIVED);
            participantConnection("dave", "alice", ConnectionStatus.REJECTED);

            UserStats stats = aggregator.refreshSentReceived("alice");

            assertEquals(2, stats.sentCount());
            assertEquals(1, stats.receivedCount());
        }

        @Test
        @DisplayName("Refreshing twice yields the same values")
        void idempotent() {
            sharedConnection("alice", "bob", ConnectionStatus.RECEIVED);

            UserStats first = aggregator.refreshSentReceived("bob");
            UserStats second = aggregator.refreshSentReceived("bob");

            assertEquals(first, second);
            assertEquals(1, second.receivedCount());
        }

        @Test
        @DisplayName("Refresh keeps the incremental counters")
        void keepsIncremental() {
            aggregator.apply("bob", StatsDelta.accepted().plus(StatsDelta.bucket(BucketType.OUTER, 1)));

            UserStats stats = aggregator.refreshSentReceived("bob");

            assertEquals(1, stats.acceptedCount());
            assertEquals(1, stats.outerCount());
        }
    }

    @Nested
    @DisplayName("Deltas")
    class DeltaTests {

        @Test
        @DisplayName("Deltas accumulate")
        void accumulate() {
            aggregator.apply("bob", StatsDelta.accepted());
            aggregator.apply("bob", StatsDelta.rejected());
            aggregator.apply("bob", StatsDelta.move(BucketType.INNER, BucketType.UNIVERSAL));

            UserStats stats = aggregator.stats("bob");
            assertEquals(1, stats.acceptedCount());
            assertEquals(1, stats.rejectedCount());
            assertEquals(-1, stats.innerCount());
            assertEquals(1, stats.bucketCount(BucketType.UNIVERSAL));
        }

        @Test
        @DisplayName("Empty deltas create no record")
        void emptySkipped() {
            StatsRepository repository = new InMemoryStatsRepository();
            StatsAggregator local = new StatsAggregator(repository, List.of());

            local.apply("bob", StatsDelta.move(BucketType.INNER, BucketType.INNER));

            assertTrue(repository.find("bob").isEmpty());
            assertEquals(UserStats.empty("bob"), local.stats("bob"));
        }

        @Test
        @DisplayName("Moves between buckets and null buckets")
        void moves() {
            assertEquals(new StatsDelta(0, 0, -1, 1, 0), StatsDelta.move(BucketType.INNER, BucketType.OUTER));
            assertEquals(new StatsDelta(0, 0, 0, 0, 1), StatsDelta.move(null, BucketType.UNIVERSAL));
            assertTrue(StatsDelta.bucket(null, 1).isEmpty());
        }
    }
}
