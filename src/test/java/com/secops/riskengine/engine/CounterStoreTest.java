package com.secops.riskengine.engine;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CounterStoreTest {

    private final CounterStore store = new CounterStore();
    private final TrackingKey key = new TrackingKey("U1", "2024-01-15", "Search", null);

    @Test
    void increment_firstEvent_createsState() {
        assertThat(store.get(key)).isEmpty();

        CounterState state = store.increment(key, Instant.parse("2024-01-15T09:00:00Z"));

        assertThat(state.getCount()).isEqualTo(1);
        assertThat(store.get(key)).containsSame(state);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void increment_outOfOrderTimes_keepsEarliestAndLatest() {
        store.increment(key, Instant.parse("2024-01-15T10:00:00Z"));
        store.increment(key, Instant.parse("2024-01-15T08:00:00Z"));
        CounterState state = store.increment(key, Instant.parse("2024-01-15T09:00:00Z"));

        assertThat(state.getCount()).isEqualTo(3);
        assertThat(state.getFirstSeen()).isEqualTo(Instant.parse("2024-01-15T08:00:00Z"));
        assertThat(state.getLastSeen()).isEqualTo(Instant.parse("2024-01-15T10:00:00Z"));
    }

    @Test
    void increment_withoutTimestamp_countsOnly() {
        CounterState state = store.increment(key, null);

        assertThat(state.getCount()).isEqualTo(1);
        assertThat(state.getFirstSeen()).isNull();
    }

    @Test
    void markAlerted_sameKeyTwice_onlyFirstSucceeds() {
        CounterState state = store.increment(key, null);

        assertThat(state.markAlerted(key.alertKey())).isTrue();
        assertThat(state.markAlerted(key.alertKey())).isFalse();
        assertThat(state.getAlertedEvents()).containsExactly("Search");
    }

    @Test
    void alertKey_withFieldValue_includesValue() {
        assertThat(new TrackingKey("U1", "2024-01-15", "ReportExport", "R1").alertKey())
                .isEqualTo("ReportExport-R1");
    }
}
