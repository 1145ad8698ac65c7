package com.secops.riskengine.engine;

import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Count and observed time span of one tracking key. The count only grows and
 * an alert key can be marked once.
 */
public class CounterState {

    private long count;
    private Instant firstSeen;
    private Instant lastSeen;
    private final Set<String> alertedEvents = new HashSet<>();

    /**
     * Count one event. First/last seen keep the earliest and latest observed times,
     * independent of the order events arrive in.
     */
    public long record(Instant seenAt) {
        count++;
        if (seenAt != null) {
            if (firstSeen == null || seenAt.isBefore(firstSeen)) {
                firstSeen = seenAt;
            }
            if (lastSeen == null || seenAt.isAfter(lastSeen)) {
                lastSeen = seenAt;
            }
        }
        return count;
    }

    /** @return true if the key was not alerted before */
    public boolean markAlerted(String alertKey) {
        return alertedEvents.add(alertKey);
    }

    public long getCount() {
        return count;
    }

    public Instant getFirstSeen() {
        return firstSeen;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public Set<String> getAlertedEvents() {
        return Collections.unmodifiableSet(alertedEvents);
    }
}
