package com.secops.riskengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Ordered severity ladder shared by rules, warnings and anomalies.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return null;
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Raise this severity by {@code floor(multiplier) - 1} levels, capped at CRITICAL.
     * A multiplier below 2 leaves it unchanged.
     */
    public Severity enhance(double multiplier) {
        if (multiplier < 2) {
            return this;
        }
        int raise = (int) Math.floor(multiplier) - 1;
        Severity[] ladder = values();
        return ladder[Math.min(ordinal() + raise, ladder.length - 1)];
    }

    public static Severity enhance(Severity base, double multiplier) {
        return base == null ? null : base.enhance(multiplier);
    }
}
