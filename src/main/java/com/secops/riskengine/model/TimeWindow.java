package com.secops.riskengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Counting window of a threshold rule. NONE counts per user and day, like DAY.
 */
public enum TimeWindow {
    SESSION,
    HOUR,
    DAY,
    NONE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TimeWindow fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return TimeWindow.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * @param hour hour of day of the event, or -1 when the event has no timestamp
     */
    public String bucket(LocalDate date, int hour, String sessionKey) {
        return switch (this) {
            case SESSION -> date + "/session/" + sessionKey;
            case HOUR -> date + "/hour/" + hour;
            case DAY, NONE -> date.toString();
        };
    }
}
