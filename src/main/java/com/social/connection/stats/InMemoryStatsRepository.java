package com.social.connection.stats;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link StatsRepository}.
 * Each write is a single {@link ConcurrentHashMap#compute} call.
 */
public class InMemoryStatsRepository implements StatsRepository {

    private final Map<String, UserStats> stats = new ConcurrentHashMap<>();

    @Override
    public Optional<UserStats> find(String userId) {
        return Optional.ofNullable(stats.get(userId));
    }

    @Override
    public UserStats applyDelta(String userId, StatsDelta delta) {
        return stats.compute(userId, (id, current) ->
                (current != null ? current : UserStats.empty(id)).plus(delta));
    }

    @Override
    public UserStats overwriteSentReceived(String userId, long sent, long received) {
        return stats.compute(userId, (id, current) ->
                (current != null ? current : UserStats.empty(id)).withSentReceived(sent, received));
    }
}
