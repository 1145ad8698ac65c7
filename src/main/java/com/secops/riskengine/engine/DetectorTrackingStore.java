package com.secops.riskengine.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Private state of rate-style detectors for one engine instance,
 * kept apart from the threshold counters.
 */
public class DetectorTrackingStore {

    private final Map<String, RateTracker> trackers = new ConcurrentHashMap<>();

    /**
     * Count one occurrence under {@code key} and return the tracker after the update.
     */
    public RateTracker track(String key, Instant at) {
        return trackers.compute(key, (k, existing) -> {
            RateTracker tracker = existing != null ? existing : new RateTracker();
            tracker.record(at);
            return tracker;
        });
    }

    public int size() {
        return trackers.size();
    }

    public static class RateTracker {
        private long count;
        private Instant first;
        private Instant last;
        private boolean alerted;
        private final Set<String> distinctValues = new HashSet<>();

        void record(Instant at) {
            count++;
            if (first == null || at.isBefore(first)) {
                first = at;
            }
            if (last == null || at.isAfter(last)) {
                last = at;
            }
        }

        public long getCount() {
            return count;
        }

        public Duration span() {
            return first == null ? Duration.ZERO : Duration.between(first, last);
        }

        public void addDistinct(String value) {
            if (value != null) {
                distinctValues.add(value);
            }
        }

        public int distinctCount() {
            return distinctValues.size();
        }

        /** @return true the first time only */
        public boolean markAlerted() {
            if (alerted) {
                return false;
            }
            alerted = true;
            return true;
        }
    }
}
