package com.secops.riskengine.engine;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Threshold counters for one engine instance. States are created on first increment.
 */
public class CounterStore {

    private final Map<TrackingKey, CounterState> counters = new ConcurrentHashMap<>();

    /**
     * Count an event against {@code key} and return its state after the increment.
     */
    public CounterState increment(TrackingKey key, Instant seenAt) {
        return counters.compute(key, (k, existing) -> {
            CounterState state = existing != null ? existing : new CounterState();
            state.record(seenAt);
            return state;
        });
    }

    public Optional<CounterState> get(TrackingKey key) {
        return Optional.ofNullable(counters.get(key));
    }

    public Map<TrackingKey, Long> snapshotCounts() {
        Map<TrackingKey, Long> counts = new ConcurrentHashMap<>();
        counters.forEach((key, state) -> counts.put(key, state.getCount()));
        return counts;
    }

    public int size() {
        return counters.size();
    }
}
